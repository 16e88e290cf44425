package io.github.chirino.atlas.projection;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads {@link LinearProjectionModel} artifacts from disk. */
@ApplicationScoped
public class ProjectionModelLoader {

    @Inject ObjectMapper objectMapper;

    public ProjectionModelLoader() {}

    public ProjectionModelLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ProjectionModel load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ProjectionException("Projection model file not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return objectMapper.readValue(in, LinearProjectionModel.class);
        } catch (IOException e) {
            throw new ProjectionException("Could not read projection model " + path, e);
        }
    }
}
