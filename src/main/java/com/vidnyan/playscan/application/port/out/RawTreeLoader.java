package com.vidnyan.playscan.application.port.out;

import com.vidnyan.playscan.domain.raw.RawNode;

import java.nio.file.Path;

/**
 * Port for reading script files into position-tagged raw trees.
 * Implemented by YAML adapters; the analysis core never parses text itself.
 */
public interface RawTreeLoader {

    /**
     * Load one file.
     *
     * @throws com.vidnyan.playscan.domain.error.RawTreeLoadException when the file cannot be read or parsed
     */
    RawNode load(Path file);
}
