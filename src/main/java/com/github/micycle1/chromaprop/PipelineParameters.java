package com.github.micycle1.chromaprop;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.chromaprop.seed.Colormap;

/**
 * Immutable parameter set of one pipeline run.
 * <p>
 * Ranges:
 * <ul>
 * <li>{@code W} (LIP power) in [0, 10]</li>
 * <li>{@code E} (CST slope) in [0, 2]</li>
 * <li>{@code k_log} (logistic steepness) in [1, 50]</li>
 * <li>{@code smooth_sigma} (Gaussian smoothing, 0 disables) in [0, 5]</li>
 * <li>{@code seed_ratio} (fraction of seeded pixels) in (0, 0.5]</li>
 * <li>{@code sigma} (graph weight sensitivity) in [1, 20]</li>
 * </ul>
 * Instances come from {@link #builder()}, {@link #defaults()},
 * {@link #fromProperties(Properties)} or {@link #loadDefaults()}.
 */
public final class PipelineParameters {

	private static final Logger LOG = LoggerFactory.getLogger(PipelineParameters.class);

	/** Classpath resource read by {@link #loadDefaults()}. */
	public static final String DEFAULTS_RESOURCE = "/chromaprop-defaults.properties";

	public static final String KEY_W = "W";
	public static final String KEY_E = "E";
	public static final String KEY_K_LOG = "k_log";
	public static final String KEY_SMOOTH_SIGMA = "smooth_sigma";
	public static final String KEY_SEED_RATIO = "seed_ratio";
	public static final String KEY_SIGMA = "sigma";
	public static final String KEY_RNG_SEED = "rng_seed";
	public static final String KEY_COLORMAP = "colormap";
	public static final String KEY_PARALLEL_CHANNELS = "parallel_channels";

	public static final double DEFAULT_W = 3.0;
	public static final double DEFAULT_E = 0.5;
	public static final double DEFAULT_K_LOG = 10.0;
	public static final double DEFAULT_SMOOTH_SIGMA = 0.5;
	public static final double DEFAULT_SEED_RATIO = 0.05;
	public static final double DEFAULT_SIGMA = 5.0;

	private final double w;
	private final double e;
	private final double kLog;
	private final double smoothSigma;
	private final double seedRatio;
	private final double sigma;
	private final long rngSeed;
	private final Colormap colormap;
	private final boolean parallelChannels;

	private PipelineParameters(Builder b) {
		this.w = b.w;
		this.e = b.e;
		this.kLog = b.kLog;
		this.smoothSigma = b.smoothSigma;
		this.seedRatio = b.seedRatio;
		this.sigma = b.sigma;
		this.rngSeed = b.rngSeed;
		this.colormap = b.colormap;
		this.parallelChannels = b.parallelChannels;
	}

	public static Builder builder() {
		return new Builder();
	}

	public static PipelineParameters defaults() {
		return builder().build();
	}

	/**
	 * Reads parameters from properties; absent keys keep their defaults.
	 *
	 * @throws InvalidParameterException if a value cannot be parsed or is out of
	 *                                   range
	 */
	public static PipelineParameters fromProperties(Properties props) {
		Builder b = builder();
		b.w(doubleProperty(props, KEY_W, DEFAULT_W));
		b.e(doubleProperty(props, KEY_E, DEFAULT_E));
		b.kLog(doubleProperty(props, KEY_K_LOG, DEFAULT_K_LOG));
		b.smoothSigma(doubleProperty(props, KEY_SMOOTH_SIGMA, DEFAULT_SMOOTH_SIGMA));
		b.seedRatio(doubleProperty(props, KEY_SEED_RATIO, DEFAULT_SEED_RATIO));
		b.sigma(doubleProperty(props, KEY_SIGMA, DEFAULT_SIGMA));

		String seed = trimmed(props, KEY_RNG_SEED);
		if (seed != null) {
			try {
				b.rngSeed(Long.parseLong(seed));
			} catch (NumberFormatException ex) {
				throw new InvalidParameterException(PipelineStage.PARAMETERS, KEY_RNG_SEED + " is not an integer: '" + seed + "'", ex);
			}
		}
		String cmap = trimmed(props, KEY_COLORMAP);
		if (cmap != null) {
			try {
				b.colormap(Colormap.valueOf(cmap.toUpperCase(Locale.ROOT)));
			} catch (IllegalArgumentException ex) {
				throw new InvalidParameterException(PipelineStage.PARAMETERS, "Unknown colormap '" + cmap + "'", ex);
			}
		}
		String parallel = trimmed(props, KEY_PARALLEL_CHANNELS);
		if (parallel != null) {
			b.parallelChannels(Boolean.parseBoolean(parallel));
		}
		return b.build();
	}

	/**
	 * Parameters from {@value #DEFAULTS_RESOURCE} on the classpath, or the
	 * built-in defaults when that resource does not exist.
	 */
	public static PipelineParameters loadDefaults() {
		try (InputStream in = PipelineParameters.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
			if (in == null) {
				LOG.debug("{} not found, using built-in defaults", DEFAULTS_RESOURCE);
				return defaults();
			}
			Properties props = new Properties();
			props.load(in);
			return fromProperties(props);
		} catch (IOException ex) {
			throw new UncheckedIOException("Failed to read " + DEFAULTS_RESOURCE, ex);
		}
	}

	public double getW() {
		return w;
	}

	public double getE() {
		return e;
	}

	public double getKLog() {
		return kLog;
	}

	public double getSmoothSigma() {
		return smoothSigma;
	}

	public double getSeedRatio() {
		return seedRatio;
	}

	public double getSigma() {
		return sigma;
	}

	public long getRngSeed() {
		return rngSeed;
	}

	public Colormap getColormap() {
		return colormap;
	}

	public boolean isParallelChannels() {
		return parallelChannels;
	}

	/** A builder pre-filled with these values. */
	public Builder toBuilder() {
		return builder().w(w).e(e).kLog(kLog).smoothSigma(smoothSigma).seedRatio(seedRatio).sigma(sigma).rngSeed(rngSeed)
				.colormap(colormap).parallelChannels(parallelChannels);
	}

	@Override
	public String toString() {
		return String.format(Locale.ROOT, "PipelineParameters{W=%s, E=%s, k_log=%s, smooth_sigma=%s, seed_ratio=%s, sigma=%s, rng_seed=%d, colormap=%s, parallel=%b}",
				w, e, kLog, smoothSigma, seedRatio, sigma, rngSeed, colormap, parallelChannels);
	}

	private static String trimmed(Properties props, String key) {
		String v = props.getProperty(key);
		if (v == null) {
			return null;
		}
		v = v.trim();
		return v.isEmpty() ? null : v;
	}

	private static double doubleProperty(Properties props, String key, double def) {
		String v = trimmed(props, key);
		if (v == null) {
			return def;
		}
		try {
			return Double.parseDouble(v);
		} catch (NumberFormatException ex) {
			throw new InvalidParameterException(PipelineStage.PARAMETERS, key + " is not a number: '" + v + "'", ex);
		}
	}

	public static final class Builder {

		private double w = DEFAULT_W;
		private double e = DEFAULT_E;
		private double kLog = DEFAULT_K_LOG;
		private double smoothSigma = DEFAULT_SMOOTH_SIGMA;
		private double seedRatio = DEFAULT_SEED_RATIO;
		private double sigma = DEFAULT_SIGMA;
		private long rngSeed = 0L;
		private Colormap colormap = Colormap.VIRIDIS;
		private boolean parallelChannels = false;

		private Builder() {
		}

		public Builder w(double w) {
			this.w = w;
			return this;
		}

		public Builder e(double e) {
			this.e = e;
			return this;
		}

		public Builder kLog(double kLog) {
			this.kLog = kLog;
			return this;
		}

		public Builder smoothSigma(double smoothSigma) {
			this.smoothSigma = smoothSigma;
			return this;
		}

		public Builder seedRatio(double seedRatio) {
			this.seedRatio = seedRatio;
			return this;
		}

		public Builder sigma(double sigma) {
			this.sigma = sigma;
			return this;
		}

		public Builder rngSeed(long rngSeed) {
			this.rngSeed = rngSeed;
			return this;
		}

		public Builder colormap(Colormap colormap) {
			this.colormap = colormap;
			return this;
		}

		public Builder parallelChannels(boolean parallelChannels) {
			this.parallelChannels = parallelChannels;
			return this;
		}

		/**
		 * @throws InvalidParameterException if any value is outside its range
		 */
		public PipelineParameters build() {
			checkClosed(KEY_W, w, 0, 10);
			checkClosed(KEY_E, e, 0, 2);
			checkClosed(KEY_K_LOG, kLog, 1, 50);
			checkClosed(KEY_SMOOTH_SIGMA, smoothSigma, 0, 5);
			if (!(seedRatio > 0 && seedRatio <= 0.5)) {
				throw new InvalidParameterException(PipelineStage.PARAMETERS, KEY_SEED_RATIO + " must be in (0, 0.5], got " + seedRatio);
			}
			checkClosed(KEY_SIGMA, sigma, 1, 20);
			if (colormap == null) {
				throw new InvalidParameterException(PipelineStage.PARAMETERS, KEY_COLORMAP + " must not be null");
			}
			return new PipelineParameters(this);
		}

		private static void checkClosed(String key, double v, double lo, double hi) {
			if (!(v >= lo && v <= hi)) {
				throw new InvalidParameterException(PipelineStage.PARAMETERS, key + " must be in [" + lo + ", " + hi + "], got " + v);
			}
		}
	}
}
