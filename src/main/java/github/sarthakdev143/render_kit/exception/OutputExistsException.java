package github.sarthakdev143.render_kit.exception;

import java.nio.file.Path;

public class OutputExistsException extends ConfigurationException {

    private final Path outputPath;

    public OutputExistsException(Path outputPath) {
        super("Output file already exists: " + outputPath + ". Enable overwrite to replace it.");
        this.outputPath = outputPath;
    }

    public Path outputPath() {
        return outputPath;
    }
}
