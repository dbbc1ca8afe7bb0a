package mascpcr.core.primer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import mascpcr.core.thermo.ThermoParameters;
import mascpcr.core.thermo.ThermodynamicOracle;
import mascpcr.core.thermo.ThermodynamicsException;

import org.apache.log4j.Logger;

/**
 * Hard thermodynamic cutoffs applied to candidate windows. Melting temperature is taken
 * to rise with window length, so a window below the Tm range asks for a longer window
 * while a window above the range, or one whose hairpin or homodimer melts above the
 * spurious Tm clip, ends the search at that anchor.
 * <br><br>
 * Several windows (a discriminatory primer and its wildtype counterpart) are checked
 * together: any window below the range gives {@link ThermoDecision#CONTINUE}, otherwise
 * any window over a limit gives {@link ThermoDecision#STOP}.
 */
public class ThermoFilter {

	static Logger logger = Logger.getLogger(ThermoFilter.class.getName());

	private final ThermodynamicOracle oracle;
	private final ThermoParameters params;
	private final double tmMin;
	private final double tmMax;
	private final double spuriousTmClip;
	private final boolean bypass;

	/**
	 * @param oracle Thermodynamic calculations
	 * @param config Cutoffs
	 * @param bypass If true every window is accepted, but all temperatures are still measured
	 */
	public ThermoFilter(ThermodynamicOracle oracle, PrimerSearchConfiguration config, boolean bypass) {
		this.oracle = oracle;
		this.params = config.getThermoParameters();
		this.tmMin = config.getTmMin();
		this.tmMax = config.getTmMax();
		this.spuriousTmClip = config.getSpuriousTmClip();
		this.bypass = bypass;
	}

	/**
	 * Check windows against the cutoffs
	 * @param windows Sequences to check together
	 * @return The decision and the temperatures measured, in window order
	 * @throws ThermodynamicsException
	 */
	public Result check(String... windows) throws ThermodynamicsException {
		double[] tms = new double[windows.length];
		for(int i = 0; i < windows.length; i++) {
			tms[i] = oracle.meltingTemperature(windows[i], params);
		}
		if(!bypass) {
			for(int i = 0; i < windows.length; i++) {
				if(tms[i] < tmMin) {
					logger.debug("CONTINUE\t" + windows[i] + "\ttm " + tms[i] + " < " + tmMin);
					return new Result(ThermoDecision.CONTINUE, measuredTmOnly(windows, tms));
				}
			}
			for(int i = 0; i < windows.length; i++) {
				if(tms[i] > tmMax) {
					logger.debug("STOP\t" + windows[i] + "\ttm " + tms[i] + " > " + tmMax);
					return new Result(ThermoDecision.STOP, measuredTmOnly(windows, tms));
				}
			}
		}
		List<WindowThermodynamics> measured = new ArrayList<WindowThermodynamics>(windows.length);
		for(int i = 0; i < windows.length; i++) {
			double hairpin = oracle.hairpin(windows[i], params).getMeltingTemp();
			double homodimer = oracle.homodimer(windows[i], params).getMeltingTemp();
			measured.add(new WindowThermodynamics(windows[i], tms[i], hairpin, homodimer));
		}
		if(!bypass) {
			for(WindowThermodynamics w : measured) {
				if(w.getHairpinTemp() > spuriousTmClip || w.getHomodimerTemp() > spuriousTmClip) {
					logger.debug("STOP\t" + w.getSequence() + "\thairpin " + w.getHairpinTemp() + " homodimer " + w.getHomodimerTemp() + " clip " + spuriousTmClip);
					return new Result(ThermoDecision.STOP, measured);
				}
			}
		}
		return new Result(ThermoDecision.ACCEPT, measured);
	}

	private static List<WindowThermodynamics> measuredTmOnly(String[] windows, double[] tms) {
		List<WindowThermodynamics> rtrn = new ArrayList<WindowThermodynamics>(windows.length);
		for(int i = 0; i < windows.length; i++) {
			rtrn.add(new WindowThermodynamics(windows[i], tms[i], Double.NaN, Double.NaN));
		}
		return rtrn;
	}

	/**
	 * Decision for a set of windows with their measured temperatures
	 */
	public static final class Result {

		private final ThermoDecision decision;
		private final List<WindowThermodynamics> windows;

		private Result(ThermoDecision decision, List<WindowThermodynamics> windows) {
			this.decision = decision;
			this.windows = Collections.unmodifiableList(windows);
		}

		public ThermoDecision getDecision() {
			return decision;
		}

		/**
		 * @param i Window position in the call to check()
		 * @return Temperatures of that window
		 */
		public WindowThermodynamics getWindow(int i) {
			return windows.get(i);
		}

	}

}
