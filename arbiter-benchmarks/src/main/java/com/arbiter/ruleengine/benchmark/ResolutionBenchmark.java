package com.arbiter.ruleengine.benchmark;

import com.arbiter.ruleengine.api.model.Facts;
import com.arbiter.ruleengine.api.model.MatchResult;
import com.arbiter.ruleengine.api.model.Rule;
import com.arbiter.ruleengine.api.model.RuleSet;
import com.arbiter.ruleengine.compiler.defaults.DefaultRuleSets;
import com.arbiter.ruleengine.runtime.evaluation.ResolutionEngine;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;
import org.openjdk.jmh.runner.options.TimeValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Resolution throughput against the scholarship rules and against larger synthetic
 * rule sets built in the same shape.
 * <p>
 * USAGE:
 * # Build and run all
 * mvn clean package -pl arbiter-benchmarks -am -DskipTests
 * java -cp "arbiter-benchmarks/target/classes:..." com.arbiter.ruleengine.benchmark.ResolutionBenchmark
 * <p>
 * CONFIGURATION:
 * -Dbench.quick : fewer, shorter iterations
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 10, time = 3)
public class ResolutionBenchmark {

    private static final boolean QUICK_MODE = Boolean.getBoolean("bench.quick");

    private static final Tracer NOOP_TRACER = OpenTelemetry.noop().getTracer("noop");
    private static final int FACT_POOL_SIZE = 4_096;

    /**
     * 0 means the built-in scholarship rules.
     */
    @Param({"0", "100", "1000"})
    private int syntheticRules;

    private ResolutionEngine engine;
    private RuleSet ruleSet;
    private List<Facts> factPool;
    private int next;

    @Setup(Level.Trial)
    public void setupTrial() {
        engine = new ResolutionEngine(NOOP_TRACER);
        ruleSet = syntheticRules == 0 ? DefaultRuleSets.scholarship() : syntheticRuleSet(syntheticRules);
        factPool = generateApplicants(FACT_POOL_SIZE, new Random(42));
    }

    @Benchmark
    public MatchResult resolveSingle() {
        return engine.resolve(nextFacts(), ruleSet);
    }

    @Benchmark
    public void resolveTraced(Blackhole bh) {
        bh.consume(engine.resolveWithTrace(nextFacts(), ruleSet));
    }

    @Benchmark
    @OperationsPerInvocation(100)
    public void resolveBatch100(Blackhole bh) {
        List<Facts> batch = new ArrayList<>(100);
        for (int i = 0; i < 100; i++) {
            batch.add(nextFacts());
        }
        bh.consume(engine.resolveBatch(batch, ruleSet));
    }

    private Facts nextFacts() {
        Facts facts = factPool.get(next);
        next = (next + 1) % factPool.size();
        return facts;
    }

    private static RuleSet syntheticRuleSet(int count) {
        Random random = new Random(7);
        List<Rule> rules = new ArrayList<>(count + 1);
        for (int i = 0; i < count; i++) {
            rules.add(Rule.builder("synthetic-" + i)
                    .priority(random.nextInt(100) + 2)
                    .when("cgpa", ">=", 2.0 + random.nextInt(20) / 10.0)
                    .when("co_curricular_score", ">=", random.nextInt(100))
                    .when("family_income", "<=", 2_000 + random.nextInt(18) * 1_000)
                    .when("disciplinary_actions", "<=", random.nextInt(3))
                    .then(i % 2 == 0 ? "AWARD PARTIAL" : "REVIEW", "synthetic")
                    .build());
        }
        rules.add(Rule.builder("Default non-qualifier").priority(1).then("NOT ELIGIBLE", "fallthrough").build());
        return RuleSet.of("synthetic", rules);
    }

    private static List<Facts> generateApplicants(int count, Random random) {
        List<Facts> applicants = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            applicants.add(Facts.of(Map.of(
                    "cgpa", 1.0 + random.nextInt(301) / 100.0,
                    "co_curricular_score", random.nextInt(101),
                    "family_income", random.nextInt(201) * 100,
                    "disciplinary_actions", random.nextInt(6))));
        }
        return applicants;
    }

    public static void main(String[] args) throws RunnerException {
        Options options = new OptionsBuilder()
                .include(ResolutionBenchmark.class.getSimpleName())
                .warmupIterations(QUICK_MODE ? 2 : 5)
                .warmupTime(TimeValue.seconds(QUICK_MODE ? 1 : 2))
                .measurementIterations(QUICK_MODE ? 3 : 10)
                .measurementTime(TimeValue.seconds(QUICK_MODE ? 1 : 3))
                .shouldFailOnError(true)
                .build();
        new Runner(options).run();
    }
}
