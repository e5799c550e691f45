package shellqa.snapshot;

import shellqa.player.CheckFailedError;
import shellqa.player.ShellQAException;
import shellqa.player.ViewportContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashSet;
import java.util.Set;

/**
 * Captures full-page snapshots and compares them against stored baselines.
 *
 * <p>Similarity is the mean absolute per-channel pixel difference normalised
 * to [0, 1] by dividing by 255. A comparison passes when that mean is at most
 * the threshold. Images of different dimensions are never compared.
 *
 * <h3>Baseline workflow</h3>
 * <pre>{@code
 * SnapshotEngine snapshots = new SnapshotEngine(SnapshotDirs.under(root));
 * snapshots.capture(context, "default-desktop");
 *
 * // first run, or update mode: current becomes the baseline
 * snapshots.compare("default-desktop", false, SnapshotEngine.DEFAULT_THRESHOLD);
 * }</pre>
 */
public class SnapshotEngine {

    private static final Logger log = LoggerFactory.getLogger(SnapshotEngine.class);

    /** Default maximum normalised mean difference. */
    public static final double DEFAULT_THRESHOLD = 0.004;

    private final SnapshotDirs dirs;
    private final Set<String> capturedThisRun = new HashSet<>();

    public SnapshotEngine(SnapshotDirs dirs) {
        this.dirs = dirs;
    }

    public SnapshotDirs dirs() {
        return dirs;
    }

    // ── Capture ───────────────────────────────────────────────────────────────

    /**
     * Captures the full document of {@code context} as the current image for
     * {@code name}. A name is captured at most once per engine instance.
     *
     * @return path of the written image
     */
    public Path capture(ViewportContext context, String name) {
        if (!capturedThisRun.add(name)) {
            throw new ShellQAException("Snapshot '" + name + "' was already captured in this run");
        }
        Path out = dirs.currentOf(name);
        capture(context, out);
        log.info("[{}] captured snapshot '{}' → {}", context.profile(), name, out);
        return out;
    }

    /** Writes a full-document capture of {@code context} to {@code outputPath}, creating parents. */
    public static void capture(ViewportContext context, Path outputPath) {
        byte[] png = context.captureFullPage();
        try {
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(outputPath, png);
        } catch (IOException e) {
            throw new ShellQAException("Could not write snapshot " + outputPath, e);
        }
    }

    // ── Comparison ────────────────────────────────────────────────────────────

    /**
     * Compares the current image for {@code name} against its baseline.
     *
     * <p>In update mode, or when no baseline exists yet, the current image is
     * copied over the baseline and the comparison passes. Otherwise a size
     * mismatch or a mean difference above {@code threshold} fails; only the
     * latter writes a difference image.
     *
     * @throws CheckFailedError if the current image is missing
     */
    public ComparisonResult compare(String name, boolean updateMode, double threshold) {
        Path current  = dirs.currentOf(name);
        Path baseline = dirs.baselineOf(name);

        if (!Files.exists(current)) {
            throw new CheckFailedError(CheckFailedError.Kind.ASSERTION_FAILED,
                    "missing current snapshot: " + current);
        }

        if (updateMode || !Files.exists(baseline)) {
            writeBaseline(current, baseline);
            log.info("Snapshot '{}': baseline {} → {}", name,
                    updateMode ? "updated" : "created", baseline);
            return new ComparisonResult(name, ComparisonResult.Outcome.BASELINE_WRITTEN, Double.NaN, null, null);
        }

        BufferedImage baselineImage = read(baseline);
        BufferedImage currentImage  = read(current);

        if (baselineImage.getWidth() != currentImage.getWidth()
                || baselineImage.getHeight() != currentImage.getHeight()) {
            String msg = String.format("snapshot size mismatch for %s: (%d, %d) != (%d, %d)", name,
                    baselineImage.getWidth(), baselineImage.getHeight(),
                    currentImage.getWidth(), currentImage.getHeight());
            log.warn(msg);
            return new ComparisonResult(name, ComparisonResult.Outcome.SIZE_MISMATCH, Double.NaN, null, msg);
        }

        DiffResult diff = difference(baselineImage, currentImage);
        log.info("Snapshot '{}': mean difference {} (threshold {})", name,
                String.format("%.6f", diff.mean()), threshold);

        if (!diff.isPassed(threshold)) {
            Path diffPath = dirs.diffOf(name);
            writeImage(diff.image(), diffPath);
            String msg = String.format("snapshot %s differs from baseline (mean=%.6f)", name, diff.mean());
            return new ComparisonResult(name, ComparisonResult.Outcome.MISMATCH, diff.mean(), diffPath, msg);
        }
        return new ComparisonResult(name, ComparisonResult.Outcome.MATCHED, diff.mean(), null, null);
    }

    /** Converts a failed comparison into the matching {@link CheckFailedError}. */
    public static CheckFailedError toError(ComparisonResult result) {
        CheckFailedError.Kind kind = result.outcome() == ComparisonResult.Outcome.SIZE_MISMATCH
                ? CheckFailedError.Kind.SIZE_MISMATCH
                : CheckFailedError.Kind.SNAPSHOT_MISMATCH;
        return new CheckFailedError(kind, result.message());
    }

    // ── Difference metric ─────────────────────────────────────────────────────

    /**
     * Per-pixel absolute difference of two equally sized images, and the mean
     * of the per-channel average differences normalised by 255. Alpha counts
     * as a channel only when both images carry it.
     */
    public static DiffResult difference(BufferedImage baseline, BufferedImage current) {
        int width  = baseline.getWidth();
        int height = baseline.getHeight();
        if (width != current.getWidth() || height != current.getHeight()) {
            throw new IllegalArgumentException("Images differ in size");
        }
        boolean withAlpha = baseline.getColorModel().hasAlpha() && current.getColorModel().hasAlpha();
        int channels = withAlpha ? 4 : 3;

        long[] sums = new long[4];
        BufferedImage diffImage = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int b = baseline.getRGB(x, y);
                int c = current.getRGB(x, y);
                int dr = Math.abs(((b >> 16) & 0xFF) - ((c >> 16) & 0xFF));
                int dg = Math.abs(((b >>  8) & 0xFF) - ((c >>  8) & 0xFF));
                int db = Math.abs(( b        & 0xFF) - ( c        & 0xFF));
                int da = Math.abs(((b >>> 24) & 0xFF) - ((c >>> 24) & 0xFF));
                sums[0] += dr;
                sums[1] += dg;
                sums[2] += db;
                sums[3] += da;
                diffImage.setRGB(x, y, (dr << 16) | (dg << 8) | db);
            }
        }

        long pixels = (long) width * height;
        double meanSum = 0.0;
        for (int ch = 0; ch < channels; ch++) {
            meanSum += pixels == 0 ? 0.0 : (double) sums[ch] / pixels;
        }
        return new DiffResult(meanSum / (channels * 255.0), diffImage);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static void writeBaseline(Path current, Path baseline) {
        try {
            Files.createDirectories(baseline.toAbsolutePath().getParent());
            Files.copy(current, baseline, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new ShellQAException("Could not write baseline " + baseline, e);
        }
    }

    private static BufferedImage read(Path path) {
        try {
            BufferedImage image = ImageIO.read(path.toFile());
            if (image == null) {
                throw new ShellQAException("Not a decodable image: " + path);
            }
            return image;
        } catch (IOException e) {
            throw new ShellQAException("Could not read image " + path, e);
        }
    }

    private static void writeImage(BufferedImage image, Path path) {
        try {
            Files.createDirectories(path.toAbsolutePath().getParent());
            ImageIO.write(image, "PNG", path.toFile());
            log.info("Difference image saved → {}", path.toAbsolutePath());
        } catch (IOException e) {
            throw new ShellQAException("Could not write difference image " + path, e);
        }
    }

    /** Normalised mean difference plus the per-pixel difference image. */
    public record DiffResult(double mean, BufferedImage image) {
        /** A mean exactly at the threshold passes; a NaN threshold never does. */
        public boolean isPassed(double threshold) {
            return mean <= threshold;
        }
    }
}
