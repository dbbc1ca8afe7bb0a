package mascpcr.core.primer;

import java.util.Arrays;

import mascpcr.core.thermo.ThermoParameters;

/**
 * Validated settings shared by every primer search call. Build once with
 * {@link Builder} or {@link PrimerSearchConfigurationFactory} and pass the same
 * instance to all searches; instances are immutable.
 */
public final class PrimerSearchConfiguration {

	public static final double DEFAULT_TM_MIN = 60;
	public static final double DEFAULT_TM_MAX = 65;
	public static final double DEFAULT_SPURIOUS_TM_CLIP = 40;
	public static final int DEFAULT_MIN_SIZE = 18;
	public static final int DEFAULT_MAX_SIZE = 30;
	public static final int DEFAULT_MIN_NUM_MISMATCHES = 1;
	public static final boolean DEFAULT_LENIENT_MODE = false;
	public static final double[] DEFAULT_MISMATCH_WEIGHTS = {5, 4, 4, 3, 3, 2, 1};

	private final double tmMin;
	private final double tmMax;
	private final double spuriousTmClip;
	private final int minSize;
	private final int maxSize;
	private final ThermoParameters thermoParameters;
	private final int minNumMismatches;
	private final boolean lenientMode;
	private final double[] mismatchWeights;

	private PrimerSearchConfiguration(Builder b) {
		if(b.tmMin > b.tmMax) {
			throw new IllegalArgumentException("Tm range minimum " + b.tmMin + " exceeds maximum " + b.tmMax);
		}
		if(b.tmMin == b.tmMax) {
			throw new IllegalArgumentException("Tm range must have non-zero width: " + b.tmMin);
		}
		if(!(b.spuriousTmClip > 0)) {
			throw new IllegalArgumentException("Spurious Tm clip must be positive: " + b.spuriousTmClip);
		}
		if(b.minSize < 1) {
			throw new IllegalArgumentException("Minimum primer size must be positive: " + b.minSize);
		}
		if(b.minSize > b.maxSize) {
			throw new IllegalArgumentException("Size range minimum " + b.minSize + " exceeds maximum " + b.maxSize);
		}
		if(b.thermoParameters == null) {
			throw new IllegalArgumentException("Thermodynamic parameters are required");
		}
		if(b.minNumMismatches < 0) {
			throw new IllegalArgumentException("Minimum number of mismatches must be non-negative: " + b.minNumMismatches);
		}
		if(b.mismatchWeights == null || b.mismatchWeights.length == 0) {
			throw new IllegalArgumentException("At least one mismatch weight is required");
		}
		tmMin = b.tmMin;
		tmMax = b.tmMax;
		spuriousTmClip = b.spuriousTmClip;
		minSize = b.minSize;
		maxSize = b.maxSize;
		thermoParameters = b.thermoParameters;
		minNumMismatches = b.minNumMismatches;
		lenientMode = b.lenientMode;
		mismatchWeights = b.mismatchWeights.clone();
	}

	/**
	 * @return A builder holding the default values
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @return A builder initialized from this configuration
	 */
	public Builder toBuilder() {
		return new Builder()
				.setTmRange(tmMin, tmMax)
				.setSpuriousTmClip(spuriousTmClip)
				.setSizeRange(minSize, maxSize)
				.setThermoParameters(thermoParameters)
				.setMinNumMismatches(minNumMismatches)
				.setLenientMode(lenientMode)
				.setMismatchWeights(mismatchWeights);
	}

	public double getTmMin() {
		return tmMin;
	}

	public double getTmMax() {
		return tmMax;
	}

	/**
	 * @return Midpoint of the melting temperature range
	 */
	public double getTargetTm() {
		return 0.5 * (tmMin + tmMax);
	}

	/**
	 * @return Width of the melting temperature range
	 */
	public double getTmRangeWidth() {
		return tmMax - tmMin;
	}

	public double getSpuriousTmClip() {
		return spuriousTmClip;
	}

	public int getMinSize() {
		return minSize;
	}

	public int getMaxSize() {
		return maxSize;
	}

	public ThermoParameters getThermoParameters() {
		return thermoParameters;
	}

	public int getMinNumMismatches() {
		return minNumMismatches;
	}

	public boolean isLenientMode() {
		return lenientMode;
	}

	/**
	 * @return Copy of the mismatch weights, index 0 is the 3'-most base
	 */
	public double[] getMismatchWeights() {
		return mismatchWeights.clone();
	}

	/**
	 * Weight of a mismatch at an offset from the 3' end; offsets past the end
	 * of the table reuse the last weight
	 * @param offset Offset from the 3' end
	 * @return The weight
	 */
	public double getMismatchWeight(int offset) {
		if(offset < mismatchWeights.length) {
			return mismatchWeights[offset];
		}
		return mismatchWeights[mismatchWeights.length - 1];
	}

	@Override
	public String toString() {
		return "tm_range=" + tmMin + "-" + tmMax + " spurious_tm_clip=" + spuriousTmClip + " size_range=" + minSize + "-" + maxSize
				+ " min_num_mismatches=" + minNumMismatches + " lenient_mode=" + lenientMode
				+ " mismatch_weights=" + Arrays.toString(mismatchWeights) + " thermo_params=[" + thermoParameters + "]";
	}

	/**
	 * Collects settings, starting from the defaults, and validates them in {@link #build()}
	 */
	public static final class Builder {

		private double tmMin = DEFAULT_TM_MIN;
		private double tmMax = DEFAULT_TM_MAX;
		private double spuriousTmClip = DEFAULT_SPURIOUS_TM_CLIP;
		private int minSize = DEFAULT_MIN_SIZE;
		private int maxSize = DEFAULT_MAX_SIZE;
		private ThermoParameters thermoParameters = ThermoParameters.getDefault();
		private int minNumMismatches = DEFAULT_MIN_NUM_MISMATCHES;
		private boolean lenientMode = DEFAULT_LENIENT_MODE;
		private double[] mismatchWeights = DEFAULT_MISMATCH_WEIGHTS.clone();

		private Builder() {}

		public Builder setTmRange(double min, double max) {
			tmMin = min;
			tmMax = max;
			return this;
		}

		public Builder setSpuriousTmClip(double clip) {
			spuriousTmClip = clip;
			return this;
		}

		public Builder setSizeRange(int min, int max) {
			minSize = min;
			maxSize = max;
			return this;
		}

		public Builder setThermoParameters(ThermoParameters params) {
			thermoParameters = params;
			return this;
		}

		public Builder setMinNumMismatches(int min) {
			minNumMismatches = min;
			return this;
		}

		public Builder setLenientMode(boolean lenient) {
			lenientMode = lenient;
			return this;
		}

		public Builder setMismatchWeights(double[] weights) {
			mismatchWeights = weights == null ? null : weights.clone();
			return this;
		}

		/**
		 * @return The configuration
		 * @throws IllegalArgumentException If any setting is invalid
		 */
		public PrimerSearchConfiguration build() {
			return new PrimerSearchConfiguration(this);
		}

	}

}
