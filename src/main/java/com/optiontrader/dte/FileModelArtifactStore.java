package com.optiontrader.dte;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.tribuo.Model;
import org.tribuo.regression.Regressor;

/**
 * Stores Tribuo regressors on the local filesystem with Java serialization.
 *
 * <p>Saves go to a sibling temp file first and are moved into place, so a reader never
 * sees a half-written artifact.
 */
@Component
public class FileModelArtifactStore implements ModelArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(FileModelArtifactStore.class);

    @Override
    public boolean exists(Path path) {
        return Files.isRegularFile(path);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Optional<Model<Regressor>> load(Path path) {
        try (ObjectInputStream in = new ObjectInputStream(new BufferedInputStream(Files.newInputStream(path)))) {
            Object artifact = in.readObject();
            if (!(artifact instanceof Model<?> model) || !model.validate(Regressor.class)) {
                log.warn("Artifact at {} is not a regression model, ignoring it", path);
                return Optional.empty();
            }
            return Optional.of((Model<Regressor>) model);
        } catch (IOException | ClassNotFoundException | RuntimeException e) {
            log.error("Error loading DTE model from {}", path, e);
            return Optional.empty();
        }
    }

    @Override
    public void save(Model<Regressor> model, Path path) throws IOException {
        Path target = path.toAbsolutePath();
        Files.createDirectories(target.getParent());
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try (ObjectOutputStream out = new ObjectOutputStream(new BufferedOutputStream(Files.newOutputStream(temp)))) {
            out.writeObject(model);
        }
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        log.debug("Saved DTE model to {}", target);
    }
}
