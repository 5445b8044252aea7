package com.optiontrader.dte;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import org.tribuo.Model;
import org.tribuo.regression.Regressor;

/**
 * Persistence for the trained DTE regressor.
 */
public interface ModelArtifactStore {

    boolean exists(Path path);

    /**
     * Loads a regressor. Any read or format failure is reported as empty.
     */
    Optional<Model<Regressor>> load(Path path);

    /**
     * Writes a regressor, creating parent directories as needed.
     */
    void save(Model<Regressor> model, Path path) throws IOException;
}
