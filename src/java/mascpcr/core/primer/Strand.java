package mascpcr.core.primer;

/**
 * Genome strand a primer anneals to, with the sign used in coordinate arithmetic
 */
public enum Strand {

	FORWARD(1),
	REVERSE(-1);

	private final int sign;

	private Strand(int sign) {
		this.sign = sign;
	}

	/**
	 * @return 1 for forward, -1 for reverse
	 */
	public int getSign() {
		return sign;
	}

	/**
	 * @param value 1 or -1
	 * @return The strand
	 * @throws IllegalArgumentException If the value is not 1 or -1
	 */
	public static Strand fromValue(int value) {
		if(value == 1) return FORWARD;
		if(value == -1) return REVERSE;
		throw new IllegalArgumentException("Strand must be 1 or -1: " + value);
	}

	@Override
	public String toString() {
		return Integer.toString(sign);
	}

}
