package com.phillippitts.scalogram.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Command-line batch settings.
 *
 * <p>Properties:
 * <ul>
 *   <li>scalogram.batch.enabled - run the batch on startup (default: true)</li>
 *   <li>scalogram.batch.input-directory - directory scanned for input files (default: in)</li>
 *   <li>scalogram.batch.output-directory - PNG destination, created when missing (default: out)</li>
 *   <li>scalogram.batch.file-extension - suffix of input files (default: .aaa)</li>
 *   <li>scalogram.batch.fail-on-error - exit with status 1 when any file failed (default: true)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "scalogram.batch")
@Validated
public class BatchProperties {

    private boolean enabled = true;

    @NotBlank(message = "Input directory must not be blank")
    private String inputDirectory = "in";

    @NotBlank(message = "Output directory must not be blank")
    private String outputDirectory = "out";

    @Pattern(regexp = "\\.[^./\\\\]+", message = "File extension must start with a dot, e.g. .aaa")
    private String fileExtension = ".aaa";

    private boolean failOnError = true;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getInputDirectory() {
        return inputDirectory;
    }

    public void setInputDirectory(String inputDirectory) {
        this.inputDirectory = inputDirectory;
    }

    public String getOutputDirectory() {
        return outputDirectory;
    }

    public void setOutputDirectory(String outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    public String getFileExtension() {
        return fileExtension;
    }

    public void setFileExtension(String fileExtension) {
        this.fileExtension = fileExtension;
    }

    public boolean isFailOnError() {
        return failOnError;
    }

    public void setFailOnError(boolean failOnError) {
        this.failOnError = failOnError;
    }
}
