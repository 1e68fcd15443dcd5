package com.example.subtitlesync.model;

public record ServerInfo(String friendlyName, String version, String platform) {
}
