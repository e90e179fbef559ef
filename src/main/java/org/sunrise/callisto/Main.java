package org.sunrise.callisto;

import java.io.File;
import java.io.IOException;
import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.sunrise.callisto.archive.CallistoArchive;
import org.sunrise.callisto.archive.RecordingOrder;
import org.sunrise.callisto.background.AdaptiveGaussianBackgroundSubtraction;
import org.sunrise.callisto.cmap.SAOColorMap;
import org.sunrise.callisto.filter.AdaptiveMedianFilter;
import org.sunrise.callisto.filter.FilterParam;
import org.sunrise.callisto.render.SpectrogramRenderer;
import org.sunrise.callisto.snr.BurstLabel;
import org.sunrise.callisto.snr.BurstLabels;
import org.sunrise.callisto.snr.SignalToNoise;

/**
 * Command line entry point.
 */
public class Main {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    private static final String USAGE = String.join("\n",
            "Usage:",
            "  filter <spectrogram.fits> [output.fits]",
            "  background <spectrogram.fits> [output.fits]",
            "  snr <spectrogram.fits> <labels.csv>",
            "  oneday <station> <month> <day> <year> [HHMMSS]",
            "  render <spectrogram.fits> <output.png> [grey|viridis]");

    public static void main(String[] args) throws IOException {
        if (args.length < 2) {
            usage();
            return;
        }
        switch (args[0]) {
            case "filter" ->
                filter(args);
            case "background" ->
                background(args);
            case "snr" ->
                snr(args);
            case "oneday" ->
                oneDay(args);
            case "render" ->
                render(args);
            default ->
                usage();
        }
    }

    private static void filter(String[] args) throws IOException {
        File input = new File(args[1]);
        File output = new File(args.length > 2 ? args[2] : derivedName(args[1], "-AMF"));
        Spectrogram spectrogram = SpectrogramFits.read(input);
        ExecutorService executor = Executors.newFixedThreadPool(Runtime.getRuntime().availableProcessors());
        try {
            FilterParam param = new FilterParam();
            param.setExecutor(executor);
            AdaptiveMedianFilter filter = new AdaptiveMedianFilter(param);
            Spectrogram filtered = Timed.execute(Level.INFO, () -> filter.filter(spectrogram), "Filtered %s in %dms", spectrogram);
            SpectrogramFits.write(filtered, output);
        } finally {
            executor.shutdown();
        }
        System.out.println("Processed spectrogram saved to " + output);
    }

    private static void background(String[] args) throws IOException {
        File input = new File(args[1]);
        File output = new File(args.length > 2 ? args[2] : derivedName(args[1], "-AGBS"));
        Spectrogram spectrogram = SpectrogramFits.read(input);
        Spectrogram processed = new AdaptiveGaussianBackgroundSubtraction().subtract(spectrogram);
        SpectrogramFits.write(processed, output);
        System.out.println("Processed spectrogram saved to " + output);
    }

    private static void snr(String[] args) throws IOException {
        if (args.length < 3) {
            usage();
            return;
        }
        Spectrogram spectrogram = SpectrogramFits.read(new File(args[1]));
        List<BurstLabel> labels = BurstLabels.read(Paths.get(args[2]));
        SignalToNoise snr = SignalToNoise.compute(spectrogram, labels);
        System.out.printf("Signal mean: %.3f%n", snr.getSignalMean());
        System.out.printf("Noise mean: %.3f%n", snr.getNoiseMean());
        System.out.printf("SNR: %.2f dB%n", snr.getSnrDb());
    }

    private static void oneDay(String[] args) throws IOException {
        if (args.length < 5) {
            usage();
            return;
        }
        String station = args[1];
        LocalDate date;
        LocalTime dayStart;
        try {
            date = parseDate(args[2], args[3], args[4]);
            dayStart = RecordingOrder.parseDayStart(args.length > 5 ? args[5] : "130000");
        } catch (IllegalArgumentException x) {
            System.err.println(x.getMessage());
            usage();
            return;
        }
        Spectrogram spectrogram = new CallistoArchive().oneDay(station, date, dayStart);
        File output = new File(String.format("spec-%s-%d-%d-%d.fits", station, date.getMonthValue(), date.getDayOfMonth(), date.getYear()));
        SpectrogramFits.write(spectrogram, output);
        LOG.log(Level.INFO, "Wrote {0} to {1}", new Object[]{spectrogram, output});
    }

    private static void render(String[] args) throws IOException {
        if (args.length < 3) {
            usage();
            return;
        }
        Spectrogram spectrogram = SpectrogramFits.read(new File(args[1]));
        SpectrogramRenderer renderer = args.length > 3
                ? new SpectrogramRenderer(new SAOColorMap(256, args[3] + ".sao"))
                : new SpectrogramRenderer();
        renderer.write(spectrogram, new File(args[2]));
    }

    /**
     * @throws IllegalArgumentException If the fields are not numbers or do not
     * form a date
     */
    static LocalDate parseDate(String month, String day, String year) {
        try {
            return LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day));
        } catch (NumberFormatException | DateTimeException x) {
            throw new IllegalArgumentException("Invalid date: " + month + " " + day + " " + year, x);
        }
    }

    static String derivedName(String input, String suffix) {
        if (input.endsWith(".gz")) {
            input = input.substring(0, input.length() - 3);
        }
        int dot = input.lastIndexOf('.');
        int slash = Math.max(input.lastIndexOf('/'), input.lastIndexOf(File.separatorChar));
        if (dot <= slash) {
            return input + suffix + ".fits";
        }
        return input.substring(0, dot) + suffix + ".fits";
    }

    private static void usage() {
        System.err.println(USAGE);
        System.exit(1);
    }
}
