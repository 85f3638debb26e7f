package com.phillippitts.scalogram.service.io;

import com.phillippitts.scalogram.config.properties.OutputProperties;
import com.phillippitts.scalogram.domain.AmplitudeScale;
import com.phillippitts.scalogram.domain.AxisTick;
import com.phillippitts.scalogram.domain.ScalogramImage;
import com.phillippitts.scalogram.domain.VerticalAxis;
import com.phillippitts.scalogram.exception.OutputFailureException;
import com.phillippitts.scalogram.service.render.ColorMaps;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.imageio.ImageIO;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Objects;

/**
 * Writes scalograms as PNG files named {@code <stem>.png} into an output directory.
 *
 * <p>With annotation enabled the PNG is a figure: title, the raster stretched to a fixed plot
 * area, axis ticks and labels, a colour bar and a subtitle naming wavelet family, padding and
 * amplitude mapping. Otherwise the bare raster is written at its native size.
 *
 * <p>Each PNG is written to a temporary file in the output directory and then moved onto its
 * final name, atomically where the file system allows. Files whose names share the stem before
 * the first dot overwrite each other; the last move wins and readers never see a partial file.
 */
public class PngScalogramSink implements ScalogramSink {

    private static final Logger LOG = LogManager.getLogger(PngScalogramSink.class);

    static final int PLOT_WIDTH = 800;
    static final int PLOT_HEIGHT = 300;
    private static final int MARGIN_LEFT = 80;
    private static final int MARGIN_RIGHT = 130;
    private static final int MARGIN_TOP = 60;
    private static final int MARGIN_BOTTOM = 60;
    private static final int COLORBAR_GAP = 20;
    private static final int COLORBAR_WIDTH = 18;
    private static final int TICK_LENGTH = 5;
    static final String TEMP_SUFFIX = ".png.tmp";

    private final Path outputDirectory;
    private final OutputProperties properties;

    public PngScalogramSink(Path outputDirectory, OutputProperties properties) {
        this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    /**
     * @param identifier input identifier
     * @return path the image for that identifier is written to
     */
    public Path targetFor(String identifier) {
        return outputDirectory.resolve(OutputNames.pngFileName(identifier));
    }

    @Override
    public void emit(String identifier, ScalogramImage image) {
        Path target = targetFor(identifier);
        Path temp = null;
        try {
            Files.createDirectories(outputDirectory);
            String stem = OutputNames.stem(identifier);
            BufferedImage output = properties.isAnnotate()
                    ? drawFigure(stem, image)
                    : image.toBufferedImage();
            temp = Files.createTempFile(outputDirectory, stem + ".", TEMP_SUFFIX);
            try (OutputStream out = Files.newOutputStream(temp)) {
                if (!ImageIO.write(output, "png", out)) {
                    throw new IOException("No PNG writer available");
                }
            }
            moveIntoPlace(temp, target);
            temp = null;
            LOG.info("Wrote scalogram {} ({}x{})", target, output.getWidth(), output.getHeight());
        } catch (IOException | RuntimeException e) {
            throw new OutputFailureException(target, e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move unsupported for {}, replacing non-atomically", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOG.warn("Could not delete temporary file {}: {}", temp, e.getMessage());
        }
    }

    BufferedImage drawFigure(String title, ScalogramImage image) {
        int plotX = MARGIN_LEFT;
        int plotY = MARGIN_TOP;
        int figureWidth = MARGIN_LEFT + PLOT_WIDTH + MARGIN_RIGHT;
        int figureHeight = MARGIN_TOP + PLOT_HEIGHT + MARGIN_BOTTOM;

        BufferedImage figure = new BufferedImage(figureWidth, figureHeight, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = figure.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, figureWidth, figureHeight);

            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR);
            g.drawImage(image.toBufferedImage(), plotX, plotY, PLOT_WIDTH, PLOT_HEIGHT, null);

            g.setColor(Color.BLACK);
            g.setStroke(new BasicStroke(1f));
            g.drawRect(plotX, plotY, PLOT_WIDTH, PLOT_HEIGHT);

            Font tickFont = new Font(Font.SANS_SERIF, Font.PLAIN, 11);
            Font labelFont = new Font(Font.SANS_SERIF, Font.PLAIN, 13);
            g.setFont(tickFont);
            FontMetrics fm = g.getFontMetrics();

            for (AxisTick tick : image.timeTicks()) {
                int x = plotX + (int) Math.round((tick.pixel() + 0.5) * PLOT_WIDTH / image.width());
                g.drawLine(x, plotY + PLOT_HEIGHT, x, plotY + PLOT_HEIGHT + TICK_LENGTH);
                g.drawString(tick.label(), x - fm.stringWidth(tick.label()) / 2,
                        plotY + PLOT_HEIGHT + TICK_LENGTH + fm.getAscent());
            }
            for (AxisTick tick : image.verticalTicks()) {
                int y = plotY + (int) Math.round((tick.pixel() + 0.5) * PLOT_HEIGHT / image.height());
                g.drawLine(plotX - TICK_LENGTH, y, plotX, y);
                g.drawString(tick.label(), plotX - TICK_LENGTH - 2 - fm.stringWidth(tick.label()),
                        y + fm.getAscent() / 2);
            }

            g.setFont(labelFont);
            FontMetrics lfm = g.getFontMetrics();
            String xLabel = properties.getTimeAxisLabel();
            g.drawString(xLabel, plotX + (PLOT_WIDTH - lfm.stringWidth(xLabel)) / 2, figureHeight - 12);
            drawVertical(g, verticalLabel(image), 20, plotY + PLOT_HEIGHT / 2);

            drawColorbar(g, image, plotX + PLOT_WIDTH + COLORBAR_GAP, plotY, tickFont, labelFont);

            g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 15));
            FontMetrics tfm = g.getFontMetrics();
            g.drawString(title, plotX + (PLOT_WIDTH - tfm.stringWidth(title)) / 2, 24);

            g.setFont(tickFont);
            String subtitle = subtitle(image);
            g.drawString(subtitle, plotX + (PLOT_WIDTH - fm.stringWidth(subtitle)) / 2, 44);
        } finally {
            g.dispose();
        }
        return figure;
    }

    String verticalLabel(ScalogramImage image) {
        if (properties.getVerticalAxisLabel() != null && !properties.getVerticalAxisLabel().isBlank()) {
            return properties.getVerticalAxisLabel();
        }
        return image.verticalAxis() == VerticalAxis.SCALE ? "Scale" : "Frequency (Hz)";
    }

    static String subtitle(ScalogramImage image) {
        return image.transformMetadata().family().getId()
                + " | " + image.transformMetadata().padding().name().toLowerCase(Locale.ROOT) + " padding"
                + " | " + image.amplitudeScale().name().toLowerCase(Locale.ROOT) + " amplitude";
    }

    private void drawColorbar(Graphics2D g, ScalogramImage image, int x, int y, Font tickFont, Font labelFont) {
        int[] lut = ColorMaps.lookupTable(image.palette());
        for (int row = 0; row < PLOT_HEIGHT; row++) {
            int index = (int) Math.round((double) (PLOT_HEIGHT - 1 - row) * (lut.length - 1) / (PLOT_HEIGHT - 1));
            g.setColor(new Color(lut[index], true));
            g.drawLine(x, y + row, x + COLORBAR_WIDTH, y + row);
        }
        g.setColor(Color.BLACK);
        g.drawRect(x, y, COLORBAR_WIDTH, PLOT_HEIGHT);

        g.setFont(tickFont);
        FontMetrics fm = g.getFontMetrics();
        String top = String.format(Locale.ROOT, "%.3g", image.clipCeiling());
        String bottom = image.amplitudeScale() == AmplitudeScale.LINEAR
                ? "0"
                : String.format(Locale.ROOT, "-%.0f dB", image.logDynamicRangeDb());
        g.drawString(top, x + COLORBAR_WIDTH + 4, y + fm.getAscent());
        g.drawString(bottom, x + COLORBAR_WIDTH + 4, y + PLOT_HEIGHT);

        g.setFont(labelFont);
        drawVertical(g, properties.getColorbarLabel(), x + COLORBAR_WIDTH + 70, y + PLOT_HEIGHT / 2);
    }

    private static void drawVertical(Graphics2D g, String text, int x, int centerY) {
        AffineTransform saved = g.getTransform();
        FontMetrics fm = g.getFontMetrics();
        g.rotate(-Math.PI / 2, x, centerY);
        g.drawString(text, x - fm.stringWidth(text) / 2, centerY);
        g.setTransform(saved);
    }
}
