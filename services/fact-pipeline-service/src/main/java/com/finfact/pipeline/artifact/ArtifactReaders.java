package com.finfact.pipeline.artifact;

import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ArtifactReaders {

    private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactReaders.class);

    private final List<EngineArtifactReader> readers;

    public ArtifactReaders(List<EngineArtifactReader> readers) {
        this.readers = List.copyOf(readers);
    }

    public List<RawTableCandidate> read(String engine, Path artifact) {
        for (EngineArtifactReader reader : readers) {
            if (reader.supports(artifact)) {
                List<RawTableCandidate> tables = reader.read(engine, artifact);
                LOGGER.debug("Read {} tables from {} ({})", tables.size(), artifact, engine);
                return tables;
            }
        }
        LOGGER.debug("No reader for artifact {}", artifact);
        return List.of();
    }
}
