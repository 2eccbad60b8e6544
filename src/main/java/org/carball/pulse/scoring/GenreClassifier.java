package org.carball.pulse.scoring;

import java.util.List;

/**
 * Detects genres from whatever is known about the current track. A track may belong to several genres.
 */
public interface GenreClassifier {

    /**
     * @return detected genres in a stable order; empty when nothing matched
     */
    List<String> detect(String song, String artist);
}
