package mascpcr.core.thermo;

/**
 * Exception thrown when a thermodynamic calculation cannot be
 * carried out, for example because the sequence contains bases
 * other than A, C, G and T or because an external program failed.
 */
public class ThermodynamicsException extends Exception {

	private static final long serialVersionUID = 4127394811066213937L;

	/**
	 * @param message An error message describing the nature of the problem
	 */
	public ThermodynamicsException(String message) {
		super(message);
	}

	/**
	 * @param message An error message describing the nature of the problem
	 * @param cause The underlying cause of the problem
	 */
	public ThermodynamicsException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * @param cause The underlying cause of the problem
	 */
	public ThermodynamicsException(Throwable cause) {
		super(cause);
	}

}
