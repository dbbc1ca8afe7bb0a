package mascpcr.core.primer.predicate;

import org.apache.commons.collections15.Predicate;

/**
 * A yes/no check on a primer or candidate region sequence, 5' to 3'
 */
public interface PrimerSequencePredicate extends Predicate<String> {

	/**
	 * Get the name of this predicate
	 * @return Predicate name
	 */
	public String getPredicateName();

	/**
	 * Get a short explanation (no spaces) of why the predicate evaluates to false
	 * @param sequence The sequence
	 * @return Short string explanation of false value
	 */
	public String getShortFailureMessage(String sequence);

}
