package mascpcr.core.primer;

/**
 * Outcome of the thermodynamic check on one candidate window
 */
public enum ThermoDecision {

	/**
	 * The window melts too low; a longer window may pass
	 */
	CONTINUE,

	/**
	 * The window melts too high or forms spurious structures; longer windows will not pass either
	 */
	STOP,

	/**
	 * The window passes and should be scored
	 */
	ACCEPT;

}
