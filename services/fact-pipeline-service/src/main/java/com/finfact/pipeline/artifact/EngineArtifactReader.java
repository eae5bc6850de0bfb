package com.finfact.pipeline.artifact;

import java.nio.file.Path;
import java.util.List;

public interface EngineArtifactReader {

    boolean supports(Path artifact);

    /**
     * @throws ArtifactReadException when the file cannot be read or decoded
     */
    List<RawTableCandidate> read(String engine, Path artifact);
}
