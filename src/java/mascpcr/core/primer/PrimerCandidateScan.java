package mascpcr.core.primer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

import mascpcr.core.genome.RecodedGenome;
import mascpcr.core.thermo.ThermodynamicOracle;
import mascpcr.core.thermo.ThermodynamicsException;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.log4j.Logger;

/**
 * Runs primer searches at every anchor of a coordinate range on a pool of worker threads.
 * Anchors are independent, so results do not depend on the number of threads; they are
 * returned ordered by anchor and then strand (forward first).
 * <br><br>
 * The oracle must be reentrant when more than one thread is used.
 */
public class PrimerCandidateScan {

	static Logger logger = Logger.getLogger(PrimerCandidateScan.class.getName());

	private final DiscriminatoryPrimerFinder discriminatoryFinder;
	private final CommonPrimerFinder commonFinder;
	private final int numThreads;

	/**
	 * @param genome Recoded genome with its reference and lookup tables
	 * @param oracle Thermodynamic calculations
	 * @param config Search settings
	 * @param numThreads Number of worker threads
	 */
	public PrimerCandidateScan(RecodedGenome genome, ThermodynamicOracle oracle, PrimerSearchConfiguration config, int numThreads) {
		if(numThreads < 1) {
			throw new IllegalArgumentException("Number of threads must be positive: " + numThreads);
		}
		discriminatoryFinder = new DiscriminatoryPrimerFinder(genome, oracle, config);
		commonFinder = new CommonPrimerFinder(genome, oracle, config);
		this.numThreads = numThreads;
	}

	/**
	 * Find discriminatory primer pairs at every anchor in a range
	 * @param start First anchor, inclusive
	 * @param end Last anchor, inclusive
	 * @param strands Strands to search at each anchor
	 * @return Pairs found, one per anchor and strand at most
	 * @throws ThermodynamicsException If any search fails
	 * @throws InterruptedException
	 */
	public List<PrimerCandidatePair> scanDiscriminatory(int start, int end, Collection<Strand> strands) throws ThermodynamicsException, InterruptedException {
		List<Hit<PrimerCandidatePair>> hits = run(start, end, strands, new Search<PrimerCandidatePair>() {
			@Override
			public PrimerCandidatePair find(int index, Strand strand) throws ThermodynamicsException {
				PrimerCandidatePair pair = discriminatoryFinder.findPrimer(index, strand);
				return pair.isFound() ? pair : null;
			}
		});
		List<PrimerCandidatePair> rtrn = new ArrayList<PrimerCandidatePair>(hits.size());
		SummaryStatistics scores = new SummaryStatistics();
		SummaryStatistics tms = new SummaryStatistics();
		for(Hit<PrimerCandidatePair> hit : hits) {
			rtrn.add(hit.result);
			scores.addValue(hit.result.getMutantPrimer().getScore());
			tms.addValue(hit.result.getMutantPrimer().getMeltingTemp());
		}
		logSummary("discriminatory primer pairs", rtrn.size(), start, end, strands, scores, tms);
		return rtrn;
	}

	/**
	 * Find common primers at every anchor in a range
	 * @param start First anchor, inclusive
	 * @param end Last anchor, inclusive
	 * @param strands Strands to search at each anchor
	 * @return Primers found, one per anchor and strand at most
	 * @throws ThermodynamicsException If any search fails
	 * @throws InterruptedException
	 */
	public List<PrimerCandidate> scanCommon(int start, int end, Collection<Strand> strands) throws ThermodynamicsException, InterruptedException {
		List<Hit<PrimerCandidate>> hits = run(start, end, strands, new Search<PrimerCandidate>() {
			@Override
			public PrimerCandidate find(int index, Strand strand) throws ThermodynamicsException {
				return commonFinder.findPrimer(index, strand);
			}
		});
		List<PrimerCandidate> rtrn = new ArrayList<PrimerCandidate>(hits.size());
		SummaryStatistics scores = new SummaryStatistics();
		SummaryStatistics tms = new SummaryStatistics();
		for(Hit<PrimerCandidate> hit : hits) {
			rtrn.add(hit.result);
			scores.addValue(hit.result.getScore());
			tms.addValue(hit.result.getMeltingTemp());
		}
		logSummary("common primers", rtrn.size(), start, end, strands, scores, tms);
		return rtrn;
	}

	private static void logSummary(String what, int found, int start, int end, Collection<Strand> strands, SummaryStatistics scores, SummaryStatistics tms) {
		int searched = (end - start + 1) * strands.size();
		logger.info("Found " + found + " " + what + " in " + searched + " searches over " + start + "-" + end);
		if(found > 0) {
			logger.info("Score mean " + String.format("%.3f", Double.valueOf(scores.getMean())) + " (min " + String.format("%.3f", Double.valueOf(scores.getMin()))
					+ ", max " + String.format("%.3f", Double.valueOf(scores.getMax())) + "); Tm mean " + String.format("%.2f", Double.valueOf(tms.getMean()))
					+ " sd " + String.format("%.2f", Double.valueOf(tms.getStandardDeviation())));
		}
	}

	private <T> List<Hit<T>> run(int start, int end, Collection<Strand> strands, Search<T> search) throws ThermodynamicsException, InterruptedException {
		if(start > end) {
			throw new IllegalArgumentException("Scan start " + start + " is after end " + end);
		}
		if(strands == null || strands.isEmpty()) {
			throw new IllegalArgumentException("At least one strand is required");
		}
		ConcurrentLinkedQueue<Anchor> queue = new ConcurrentLinkedQueue<Anchor>();
		for(int i = start; i <= end; i++) {
			for(Strand strand : Strand.values()) {
				if(strands.contains(strand)) {
					queue.add(new Anchor(i, strand));
				}
			}
		}
		logger.info("Searching " + queue.size() + " anchors with " + numThreads + " threads");

		List<Hit<T>> hits = new ArrayList<Hit<T>>();
		List<Worker<T>> workers = new ArrayList<Worker<T>>();
		Collection<Thread> threads = new ArrayList<Thread>();
		for(int i = 0; i < numThreads; i++) {
			Worker<T> worker = new Worker<T>(queue, search, hits);
			workers.add(worker);
			Thread t = new Thread(worker);
			threads.add(t);
			t.start();
		}
		for(Thread t : threads) {
			t.join();
		}

		for(Worker<T> worker : workers) {
			if(worker.failure instanceof ThermodynamicsException) {
				throw (ThermodynamicsException)worker.failure;
			}
			if(worker.failure instanceof RuntimeException) {
				throw (RuntimeException)worker.failure;
			}
			if(worker.failure != null) {
				throw new IllegalStateException(worker.failure);
			}
		}

		Collections.sort(hits, new Comparator<Hit<T>>() {
			@Override
			public int compare(Hit<T> a, Hit<T> b) {
				if(a.anchor.index != b.anchor.index) {
					return a.anchor.index < b.anchor.index ? -1 : 1;
				}
				return a.anchor.strand.compareTo(b.anchor.strand);
			}
		});
		return hits;
	}

	private interface Search<T> {
		public T find(int index, Strand strand) throws ThermodynamicsException;
	}

	private static final class Anchor {
		final int index;
		final Strand strand;

		Anchor(int index, Strand strand) {
			this.index = index;
			this.strand = strand;
		}
	}

	private static final class Hit<T> {
		final Anchor anchor;
		final T result;

		Hit(Anchor anchor, T result) {
			this.anchor = anchor;
			this.result = result;
		}
	}

	private static class Worker<T> implements Runnable {

		private final ConcurrentLinkedQueue<Anchor> queue;
		private final Search<T> search;
		private final List<Hit<T>> hits;
		Throwable failure;

		Worker(ConcurrentLinkedQueue<Anchor> queue, Search<T> search, List<Hit<T>> hits) {
			this.queue = queue;
			this.search = search;
			this.hits = hits;
		}

		@Override
		public void run() {
			Anchor anchor;
			while((anchor = queue.poll()) != null) {
				try {
					T result = search.find(anchor.index, anchor.strand);
					if(result != null) {
						synchronized(hits) {
							hits.add(new Hit<T>(anchor, result));
						}
					}
				} catch (Exception e) {
					logger.error("Search failed at " + anchor.index + " strand " + anchor.strand + ": " + e.getMessage());
					failure = e;
					// Leave no work for the other threads
					queue.clear();
					return;
				}
			}
		}

	}

}
