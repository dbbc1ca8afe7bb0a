package mascpcr.core.primer;

import java.util.concurrent.atomic.AtomicInteger;

import mascpcr.core.sequence.SequenceUtils;
import mascpcr.core.thermo.ThermoParameters;
import mascpcr.core.thermo.ThermoResult;
import mascpcr.core.thermo.ThermodynamicOracle;
import mascpcr.core.thermo.ThermodynamicsException;

/**
 * Deterministic oracle for search tests: Tm is a linear function of length,
 * structure temperatures are constant until a given length.
 */
public class StubOracle implements ThermodynamicOracle {

	private double tmIntercept = 40;
	private double tmPerBase = 1;
	private double structureTemp = 10;
	private int structureSpikeLength = Integer.MAX_VALUE;
	private double structureSpikeTemp = 50;

	private final AtomicInteger tmCalls = new AtomicInteger();
	private final AtomicInteger structureCalls = new AtomicInteger();
	private final AtomicInteger maxTmLength = new AtomicInteger();

	public StubOracle setTm(double intercept, double perBase) {
		tmIntercept = intercept;
		tmPerBase = perBase;
		return this;
	}

	public StubOracle setStructureTemp(double temp) {
		structureTemp = temp;
		return this;
	}

	/**
	 * Windows of at least this length get the spike temperature for hairpin and homodimer
	 */
	public StubOracle setStructureSpike(int length, double temp) {
		structureSpikeLength = length;
		structureSpikeTemp = temp;
		return this;
	}

	public int getTmCalls() {
		return tmCalls.get();
	}

	public int getStructureCalls() {
		return structureCalls.get();
	}

	public int getMaxTmLength() {
		return maxTmLength.get();
	}

	@Override
	public double meltingTemperature(String sequence, ThermoParameters params) throws ThermodynamicsException {
		validate(sequence);
		tmCalls.incrementAndGet();
		int length = sequence.length();
		int seen = maxTmLength.get();
		while(length > seen && !maxTmLength.compareAndSet(seen, length)) {
			seen = maxTmLength.get();
		}
		return tmIntercept + tmPerBase * length;
	}

	@Override
	public ThermoResult hairpin(String sequence, ThermoParameters params) throws ThermodynamicsException {
		return structure(sequence);
	}

	@Override
	public ThermoResult homodimer(String sequence, ThermoParameters params) throws ThermodynamicsException {
		return structure(sequence);
	}

	private ThermoResult structure(String sequence) throws ThermodynamicsException {
		validate(sequence);
		structureCalls.incrementAndGet();
		double temp = sequence.length() >= structureSpikeLength ? structureSpikeTemp : structureTemp;
		return new ThermoResult(true, temp, -1, -10, -30);
	}

	@Override
	public String reverseComplement(String sequence) {
		return SequenceUtils.reverseComplement(sequence);
	}

	private static void validate(String sequence) throws ThermodynamicsException {
		if(!SequenceUtils.isUnambiguousDna(sequence)) {
			throw new ThermodynamicsException("Unexpected bases in " + sequence);
		}
	}

}
