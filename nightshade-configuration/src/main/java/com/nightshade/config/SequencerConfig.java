package com.nightshade.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Sequencer settings loaded from environment variables.
 * <p>
 * Validation thresholds: NIGHTSHADE_EXPOSURE_CEILING_SECS, NIGHTSHADE_LONG_SEQUENCE_SECS,
 * NIGHTSHADE_LOW_ALTITUDE_DEG, NIGHTSHADE_HIGH_BINNING, NIGHTSHADE_LONG_ESTIMATE_MINS.
 * Engine: NIGHTSHADE_POLL_INTERVAL_MS, NIGHTSHADE_PROGRESS_INTERVAL_MS, NIGHTSHADE_PARALLEL_THREADS.
 * Retry backoff: NIGHTSHADE_RETRY_INITIAL_SECS, NIGHTSHADE_RETRY_BACKOFF, NIGHTSHADE_RETRY_MAX_SECS.
 * Timeouts: NIGHTSHADE_AUTOFOCUS_TIMEOUT_SECS, NIGHTSHADE_SLEW_TIMEOUT_SECS,
 * NIGHTSHADE_EXPOSURE_OVERHEAD_SECS, NIGHTSHADE_OPERATION_TIMEOUT_SECS.
 * Site: NIGHTSHADE_SITE_LATITUDE, NIGHTSHADE_SITE_LONGITUDE.
 * Unparseable values are logged and replaced by the default.
 */
public final class SequencerConfig {

    private static final Logger log = LoggerFactory.getLogger(SequencerConfig.class);

    private static final String ENV_EXPOSURE_CEILING_SECS = "NIGHTSHADE_EXPOSURE_CEILING_SECS";
    private static final String ENV_LONG_SEQUENCE_SECS = "NIGHTSHADE_LONG_SEQUENCE_SECS";
    private static final String ENV_LOW_ALTITUDE_DEG = "NIGHTSHADE_LOW_ALTITUDE_DEG";
    private static final String ENV_HIGH_BINNING = "NIGHTSHADE_HIGH_BINNING";
    private static final String ENV_LONG_ESTIMATE_MINS = "NIGHTSHADE_LONG_ESTIMATE_MINS";
    private static final String ENV_POLL_INTERVAL_MS = "NIGHTSHADE_POLL_INTERVAL_MS";
    private static final String ENV_PROGRESS_INTERVAL_MS = "NIGHTSHADE_PROGRESS_INTERVAL_MS";
    private static final String ENV_PARALLEL_THREADS = "NIGHTSHADE_PARALLEL_THREADS";
    private static final String ENV_RETRY_INITIAL_SECS = "NIGHTSHADE_RETRY_INITIAL_SECS";
    private static final String ENV_RETRY_BACKOFF = "NIGHTSHADE_RETRY_BACKOFF";
    private static final String ENV_RETRY_MAX_SECS = "NIGHTSHADE_RETRY_MAX_SECS";
    private static final String ENV_AUTOFOCUS_TIMEOUT_SECS = "NIGHTSHADE_AUTOFOCUS_TIMEOUT_SECS";
    private static final String ENV_SLEW_TIMEOUT_SECS = "NIGHTSHADE_SLEW_TIMEOUT_SECS";
    private static final String ENV_EXPOSURE_OVERHEAD_SECS = "NIGHTSHADE_EXPOSURE_OVERHEAD_SECS";
    private static final String ENV_OPERATION_TIMEOUT_SECS = "NIGHTSHADE_OPERATION_TIMEOUT_SECS";
    private static final String ENV_SITE_LATITUDE = "NIGHTSHADE_SITE_LATITUDE";
    private static final String ENV_SITE_LONGITUDE = "NIGHTSHADE_SITE_LONGITUDE";

    /** Above this single-frame length tracking errors become likely. */
    private static final double DEFAULT_EXPOSURE_CEILING_SECS = 1800;
    /** Eight hours of integration; more is usually better split across nights. */
    private static final double DEFAULT_LONG_SEQUENCE_SECS = 28800;
    private static final double DEFAULT_LOW_ALTITUDE_DEG = 10;
    private static final int DEFAULT_HIGH_BINNING = 3;
    private static final int DEFAULT_LONG_ESTIMATE_MINS = 600;
    private static final long DEFAULT_POLL_INTERVAL_MS = 250;
    private static final long DEFAULT_PROGRESS_INTERVAL_MS = 1000;
    private static final int DEFAULT_PARALLEL_THREADS = 4;
    private static final double DEFAULT_RETRY_INITIAL_SECS = 5;
    private static final double DEFAULT_RETRY_BACKOFF = 2.0;
    private static final double DEFAULT_RETRY_MAX_SECS = 300;
    private static final long DEFAULT_AUTOFOCUS_TIMEOUT_SECS = 600;
    private static final long DEFAULT_SLEW_TIMEOUT_SECS = 300;
    private static final long DEFAULT_EXPOSURE_OVERHEAD_SECS = 120;
    private static final long DEFAULT_OPERATION_TIMEOUT_SECS = 900;

    private final double exposureCeilingSecs;
    private final double longSequenceSecs;
    private final double lowAltitudeDegrees;
    private final int highBinningFactor;
    private final int longEstimateMins;
    private final Duration pollInterval;
    private final Duration progressInterval;
    private final int parallelThreads;
    private final double retryInitialIntervalSecs;
    private final double retryBackoffCoefficient;
    private final double retryMaxIntervalSecs;
    private final Duration autofocusTimeout;
    private final Duration slewTimeout;
    private final Duration exposureOverhead;
    private final Duration operationTimeout;
    private final Double siteLatitude;
    private final Double siteLongitude;

    private SequencerConfig(Builder b) {
        this.exposureCeilingSecs = b.exposureCeilingSecs;
        this.longSequenceSecs = b.longSequenceSecs;
        this.lowAltitudeDegrees = b.lowAltitudeDegrees;
        this.highBinningFactor = b.highBinningFactor;
        this.longEstimateMins = b.longEstimateMins;
        this.pollInterval = b.pollInterval;
        this.progressInterval = b.progressInterval;
        this.parallelThreads = Math.max(1, b.parallelThreads);
        this.retryInitialIntervalSecs = Math.max(0, b.retryInitialIntervalSecs);
        this.retryBackoffCoefficient = Math.max(1.0, b.retryBackoffCoefficient);
        this.retryMaxIntervalSecs = Math.max(0, b.retryMaxIntervalSecs);
        this.autofocusTimeout = b.autofocusTimeout;
        this.slewTimeout = b.slewTimeout;
        this.exposureOverhead = b.exposureOverhead;
        this.operationTimeout = b.operationTimeout;
        this.siteLatitude = b.siteLatitude;
        this.siteLongitude = b.siteLongitude;
    }

    public static SequencerConfig defaults() {
        return builder().build();
    }

    public static SequencerConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /** Reads settings from the given variables; absent keys keep their defaults. */
    public static SequencerConfig fromEnvironment(Map<String, String> env) {
        Builder b = builder();
        b.exposureCeilingSecs = doubleValue(env, ENV_EXPOSURE_CEILING_SECS, DEFAULT_EXPOSURE_CEILING_SECS);
        b.longSequenceSecs = doubleValue(env, ENV_LONG_SEQUENCE_SECS, DEFAULT_LONG_SEQUENCE_SECS);
        b.lowAltitudeDegrees = doubleValue(env, ENV_LOW_ALTITUDE_DEG, DEFAULT_LOW_ALTITUDE_DEG);
        b.highBinningFactor = (int) longValue(env, ENV_HIGH_BINNING, DEFAULT_HIGH_BINNING);
        b.longEstimateMins = (int) longValue(env, ENV_LONG_ESTIMATE_MINS, DEFAULT_LONG_ESTIMATE_MINS);
        b.pollInterval = Duration.ofMillis(longValue(env, ENV_POLL_INTERVAL_MS, DEFAULT_POLL_INTERVAL_MS));
        b.progressInterval = Duration.ofMillis(longValue(env, ENV_PROGRESS_INTERVAL_MS, DEFAULT_PROGRESS_INTERVAL_MS));
        b.parallelThreads = (int) longValue(env, ENV_PARALLEL_THREADS, DEFAULT_PARALLEL_THREADS);
        b.retryInitialIntervalSecs = doubleValue(env, ENV_RETRY_INITIAL_SECS, DEFAULT_RETRY_INITIAL_SECS);
        b.retryBackoffCoefficient = doubleValue(env, ENV_RETRY_BACKOFF, DEFAULT_RETRY_BACKOFF);
        b.retryMaxIntervalSecs = doubleValue(env, ENV_RETRY_MAX_SECS, DEFAULT_RETRY_MAX_SECS);
        b.autofocusTimeout = Duration.ofSeconds(longValue(env, ENV_AUTOFOCUS_TIMEOUT_SECS, DEFAULT_AUTOFOCUS_TIMEOUT_SECS));
        b.slewTimeout = Duration.ofSeconds(longValue(env, ENV_SLEW_TIMEOUT_SECS, DEFAULT_SLEW_TIMEOUT_SECS));
        b.exposureOverhead = Duration.ofSeconds(longValue(env, ENV_EXPOSURE_OVERHEAD_SECS, DEFAULT_EXPOSURE_OVERHEAD_SECS));
        b.operationTimeout = Duration.ofSeconds(longValue(env, ENV_OPERATION_TIMEOUT_SECS, DEFAULT_OPERATION_TIMEOUT_SECS));
        b.siteLatitude = optionalDouble(env, ENV_SITE_LATITUDE);
        b.siteLongitude = optionalDouble(env, ENV_SITE_LONGITUDE);
        return b.build();
    }

    private static double doubleValue(Map<String, String> env, String key, double defaultValue) {
        Double v = optionalDouble(env, key);
        return v != null ? v : defaultValue;
    }

    private static Double optionalDouble(Map<String, String> env, String key) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) return null;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring unparseable setting | key={} | value={}", key, raw);
            return null;
        }
    }

    private static long longValue(Map<String, String> env, String key, long defaultValue) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring unparseable setting | key={} | value={} | default={}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    public double getExposureCeilingSecs() {
        return exposureCeilingSecs;
    }

    public double getLongSequenceSecs() {
        return longSequenceSecs;
    }

    public double getLowAltitudeDegrees() {
        return lowAltitudeDegrees;
    }

    /** Binning factor from which usage is reported as informational. */
    public int getHighBinningFactor() {
        return highBinningFactor;
    }

    public int getLongEstimateMins() {
        return longEstimateMins;
    }

    /** Cadence at which handlers poll cancellation, pause and triggers while waiting on a device. */
    public Duration getPollInterval() {
        return pollInterval;
    }

    /** Minimum spacing of periodic progress snapshots during long instructions. */
    public Duration getProgressInterval() {
        return progressInterval;
    }

    public int getParallelThreads() {
        return parallelThreads;
    }

    public double getRetryInitialIntervalSecs() {
        return retryInitialIntervalSecs;
    }

    public double getRetryBackoffCoefficient() {
        return retryBackoffCoefficient;
    }

    public double getRetryMaxIntervalSecs() {
        return retryMaxIntervalSecs;
    }

    /**
     * Backoff before retry number {@code attempt} (1-based): initial * coefficient^(attempt-1), capped.
     */
    public Duration retryBackoff(double initialSecs, int attempt) {
        double secs = initialSecs * Math.pow(retryBackoffCoefficient, Math.max(0, attempt - 1));
        secs = Math.min(secs, retryMaxIntervalSecs);
        return Duration.ofMillis(Math.round(Math.max(0, secs) * 1000));
    }

    public Duration getAutofocusTimeout() {
        return autofocusTimeout;
    }

    public Duration getSlewTimeout() {
        return slewTimeout;
    }

    /** Added to an exposure's duration to form its timeout (download, plate solve). */
    public Duration getExposureOverhead() {
        return exposureOverhead;
    }

    /** Timeout for instructions without a specific one. */
    public Duration getOperationTimeout() {
        return operationTimeout;
    }

    public Double getSiteLatitude() {
        return siteLatitude;
    }

    public Double getSiteLongitude() {
        return siteLongitude;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private double exposureCeilingSecs = DEFAULT_EXPOSURE_CEILING_SECS;
        private double longSequenceSecs = DEFAULT_LONG_SEQUENCE_SECS;
        private double lowAltitudeDegrees = DEFAULT_LOW_ALTITUDE_DEG;
        private int highBinningFactor = DEFAULT_HIGH_BINNING;
        private int longEstimateMins = DEFAULT_LONG_ESTIMATE_MINS;
        private Duration pollInterval = Duration.ofMillis(DEFAULT_POLL_INTERVAL_MS);
        private Duration progressInterval = Duration.ofMillis(DEFAULT_PROGRESS_INTERVAL_MS);
        private int parallelThreads = DEFAULT_PARALLEL_THREADS;
        private double retryInitialIntervalSecs = DEFAULT_RETRY_INITIAL_SECS;
        private double retryBackoffCoefficient = DEFAULT_RETRY_BACKOFF;
        private double retryMaxIntervalSecs = DEFAULT_RETRY_MAX_SECS;
        private Duration autofocusTimeout = Duration.ofSeconds(DEFAULT_AUTOFOCUS_TIMEOUT_SECS);
        private Duration slewTimeout = Duration.ofSeconds(DEFAULT_SLEW_TIMEOUT_SECS);
        private Duration exposureOverhead = Duration.ofSeconds(DEFAULT_EXPOSURE_OVERHEAD_SECS);
        private Duration operationTimeout = Duration.ofSeconds(DEFAULT_OPERATION_TIMEOUT_SECS);
        private Double siteLatitude;
        private Double siteLongitude;

        private Builder() {
        }

        public Builder exposureCeilingSecs(double v) { this.exposureCeilingSecs = v; return this; }
        public Builder longSequenceSecs(double v) { this.longSequenceSecs = v; return this; }
        public Builder lowAltitudeDegrees(double v) { this.lowAltitudeDegrees = v; return this; }
        public Builder highBinningFactor(int v) { this.highBinningFactor = v; return this; }
        public Builder longEstimateMins(int v) { this.longEstimateMins = v; return this; }
        public Builder pollInterval(Duration v) { this.pollInterval = v; return this; }
        public Builder progressInterval(Duration v) { this.progressInterval = v; return this; }
        public Builder parallelThreads(int v) { this.parallelThreads = v; return this; }
        public Builder retryInitialIntervalSecs(double v) { this.retryInitialIntervalSecs = v; return this; }
        public Builder retryBackoffCoefficient(double v) { this.retryBackoffCoefficient = v; return this; }
        public Builder retryMaxIntervalSecs(double v) { this.retryMaxIntervalSecs = v; return this; }
        public Builder autofocusTimeout(Duration v) { this.autofocusTimeout = v; return this; }
        public Builder slewTimeout(Duration v) { this.slewTimeout = v; return this; }
        public Builder exposureOverhead(Duration v) { this.exposureOverhead = v; return this; }
        public Builder operationTimeout(Duration v) { this.operationTimeout = v; return this; }
        public Builder site(Double latitude, Double longitude) {
            this.siteLatitude = latitude;
            this.siteLongitude = longitude;
            return this;
        }

        public SequencerConfig build() {
            return new SequencerConfig(this);
        }
    }
}
