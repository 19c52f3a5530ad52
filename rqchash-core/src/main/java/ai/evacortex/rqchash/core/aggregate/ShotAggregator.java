/*
 * RQC-Hash — Random Quantum Circuit Hash
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.rqchash.core.aggregate;

import ai.evacortex.rqchash.core.angles.AngleGenerator;
import ai.evacortex.rqchash.core.angles.AngleSchedule;
import ai.evacortex.rqchash.core.angles.AngleScheduleCache;
import ai.evacortex.rqchash.core.angles.JavaRandomAngleGenerator;
import ai.evacortex.rqchash.core.config.EvolutionMode;
import ai.evacortex.rqchash.core.config.HashRunConfig;
import ai.evacortex.rqchash.core.config.ResourceGuard;
import ai.evacortex.rqchash.core.config.RqcHashDefaults;
import ai.evacortex.rqchash.core.engine.CircuitKernel;
import ai.evacortex.rqchash.core.engine.CircuitSimulator;
import ai.evacortex.rqchash.core.engine.JavaCircuitKernel;
import ai.evacortex.rqchash.core.engine.NoOpTracer;
import ai.evacortex.rqchash.core.engine.SimulationTracer;
import ai.evacortex.rqchash.core.sampling.MeasurementSampler;
import ai.evacortex.rqchash.core.sampling.ProbabilityDistribution;
import ai.evacortex.rqchash.core.sampling.TrialRandomSource;
import ai.evacortex.rqchash.core.state.BitRegister;
import ai.evacortex.rqchash.core.state.Message;
import ai.evacortex.rqchash.core.state.StatePreparation;
import ai.evacortex.rqchash.core.state.StateVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Drives the trial loop of a run over a bounded worker pool.
 *
 * <p>Trials are split into contiguous index ranges, one per worker. Each worker owns its amplitude
 * buffer, draws from its trial-scoped random sources, and counts into a private
 * {@link HashHistogram}; the partial histograms are merged once after every worker has finished,
 * so the hot path takes no locks.</p>
 */
public final class ShotAggregator implements RqcHasher {

    private static final Logger LOG = LoggerFactory.getLogger(ShotAggregator.class);
    private static final AtomicInteger POOL_SEQ = new AtomicInteger();

    private final AngleGenerator angleGenerator;
    private final CircuitKernel kernel;
    private final SimulationTracer tracer;
    private final ResourceGuard resourceGuard;

    /** Samples one outcome for a trial index. Confined to one worker thread. */
    @FunctionalInterface
    private interface TrialRunner {
        BitRegister run(long trialIndex);
    }

    public ShotAggregator() {
        this(new AngleScheduleCache(new JavaRandomAngleGenerator(), RqcHashDefaults.SCHEDULE_CACHE_SIZE),
                new JavaCircuitKernel(), new NoOpTracer(), ResourceGuard.fromDefaults());
    }

    public ShotAggregator(AngleGenerator angleGenerator,
                          CircuitKernel kernel,
                          SimulationTracer tracer,
                          ResourceGuard resourceGuard) {
        this.angleGenerator = Objects.requireNonNull(angleGenerator, "angleGenerator must not be null");
        this.kernel = Objects.requireNonNull(kernel, "kernel must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.resourceGuard = Objects.requireNonNull(resourceGuard, "resourceGuard must not be null");
    }

    @Override
    public HashResult run(Message message, int nQubits, int depth, long seed, int shots) {
        return run(HashRunConfig.builder(message)
                .nQubits(nQubits)
                .depth(depth)
                .seed(seed)
                .shots(shots)
                .build());
    }

    @Override
    public HashResult run(HashRunConfig config) {
        Objects.requireNonNull(config, "config must not be null").validate();
        resourceGuard.check(config);

        long started = System.nanoTime();
        int n = config.nQubits();
        AngleSchedule schedule = angleGenerator.generate(config.seed(), config.depth(), n);
        BitRegister prepared = StatePreparation.prepare(config.message(), n);
        CircuitSimulator simulator = new CircuitSimulator(kernel, config.normGuard(), tracer);
        TrialRandomSource randomness = config.deterministicSampling()
                ? TrialRandomSource.seeded(config.samplingSeed())
                : TrialRandomSource.entropy();
        int workers = resourceGuard.effectiveWorkers(config);
        if (workers < Math.min(config.parallelism(), config.shots())) {
            LOG.debug("Memory budget allows {} of {} requested workers for nQubits={}",
                    workers, config.parallelism(), n);
        }

        LOG.debug("RQC run: nQubits={} depth={} seed={} shots={} workers={} mode={} schedule={}",
                n, config.depth(), config.seed(), config.shots(), workers, config.evolutionMode(), schedule);

        Supplier<TrialRunner> runners;
        if (config.evolutionMode() == EvolutionMode.SHARED) {
            StateVector evolved = simulator.evolve(StatePreparation.toBasisState(prepared), schedule);
            ProbabilityDistribution distribution = ProbabilityDistribution.of(evolved);
            runners = () -> trial -> MeasurementSampler.sample(distribution, randomness.forTrial(trial));
        } else {
            runners = () -> {
                StateVector state = StatePreparation.toBasisState(prepared);
                return trial -> {
                    state.resetToBasis(prepared.value());
                    simulator.evolve(state, schedule);
                    return MeasurementSampler.sample(state, randomness.forTrial(trial));
                };
            };
        }

        HashHistogram histogram = workers == 1
                ? runRange(runners.get(), n, 0, config.shots())
                : runParallel(runners, n, config.shots(), workers);

        HashEntry finalHash = histogram.mode();
        HashResult result = new HashResult(n, config.depth(), config.seed(), config.shots(),
                schedule.fingerprint(), finalHash, histogram.ranked(), config.topK());

        if (LOG.isDebugEnabled()) {
            LOG.debug("RQC run done in {} ms: final={} ({}) count={} distinct={}",
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started),
                    finalHash.bitString(), finalHash.hex(), finalHash.count(), result.distinctOutcomes());
        }
        return result;
    }

    private static HashHistogram runRange(TrialRunner runner, int nQubits, int from, int to) {
        HashHistogram local = new HashHistogram(nQubits);
        for (int trial = from; trial < to; trial++) {
            local.record(runner.run(trial));
        }
        return local;
    }

    private static HashHistogram runParallel(Supplier<TrialRunner> runners, int nQubits, int shots, int workers) {
        int poolId = POOL_SEQ.incrementAndGet();
        AtomicInteger threadSeq = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "rqchash-" + poolId + "-worker-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        try {
            List<Callable<HashHistogram>> tasks = new ArrayList<>(workers);
            for (int w = 0; w < workers; w++) {
                int from = (int) ((long) shots * w / workers);
                int to = (int) ((long) shots * (w + 1) / workers);
                tasks.add(() -> runRange(runners.get(), nQubits, from, to));
            }

            HashHistogram merged = new HashHistogram(nQubits);
            for (Future<HashHistogram> partial : pool.invokeAll(tasks)) {
                merged.merge(partial.get());
            }
            return merged;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for trials", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException("Trial worker failed", cause);
        } finally {
            pool.shutdownNow();
        }
    }
}
