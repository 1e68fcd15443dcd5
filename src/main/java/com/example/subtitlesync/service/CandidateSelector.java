package com.example.subtitlesync.service;

import com.example.subtitlesync.model.SubtitleCandidate;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

/**
 * Picks the best subtitle for a language: highest rating, then most downloads.
 * Remaining ties keep search result order.
 */
@Component
public class CandidateSelector {

    private static final Comparator<SubtitleCandidate> BEST_FIRST = Comparator
            .comparingDouble(SubtitleCandidate::rating).reversed()
            .thenComparing(Comparator.comparingInt(SubtitleCandidate::downloadCount).reversed());

    public Optional<SubtitleCandidate> selectBest(Collection<SubtitleCandidate> candidates, String language) {
        return candidates.stream()
                .filter(candidate -> language.equals(candidate.language()))
                .sorted(BEST_FIRST)
                .findFirst();
    }
}
