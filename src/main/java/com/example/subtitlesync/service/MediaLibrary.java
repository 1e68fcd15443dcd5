package com.example.subtitlesync.service;

import com.example.subtitlesync.model.LibrarySection;
import com.example.subtitlesync.model.MediaItem;
import com.example.subtitlesync.model.ServerInfo;

import java.util.List;
import java.util.Optional;

/**
 * Interface to the media server holding the libraries to scan.
 * Implemented by PlexMediaLibrary. Failures surface as {@link MediaLibraryException}.
 */
public interface MediaLibrary {

    /**
     * Identity of the connected server.
     */
    ServerInfo serverInfo();

    /**
     * All library sections, in server order.
     */
    List<LibrarySection> sections();

    /**
     * Find a section by its title.
     */
    Optional<LibrarySection> section(String title);

    /**
     * Items of a section in library order: movies for movie sections, every episode of
     * every show for show sections. Subtitle details may be incomplete until
     * {@link #reload(MediaItem)} is called.
     */
    List<MediaItem> items(LibrarySection section);

    /**
     * Fetch the full, current state of an item including its subtitle streams.
     */
    MediaItem reload(MediaItem item);

    /**
     * Ask the server to search for a subtitle in the given language and attach the first match.
     *
     * @return true if a match was found and the attach request was sent
     */
    boolean searchAndAttachSubtitle(MediaItem item, String language);
}
