/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.compiler.defaults;

import com.arbiter.ruleengine.api.model.Rule;
import com.arbiter.ruleengine.api.model.RuleSet;

import java.util.List;

/**
 * Built-in rule sets.
 *
 * <p>The scholarship set is also shipped as the classpath resource
 * {@value #SCHOLARSHIP_RESOURCE}; both forms must stay identical.
 */
public final class DefaultRuleSets {

    public static final String SOURCE = "default";
    public static final String SCHOLARSHIP_RESOURCE = "rules/scholarship-rules.json";

    private static final RuleSet SCHOLARSHIP = RuleSet.of(SOURCE, List.of(
            Rule.builder("Top merit candidate")
                    .priority(100)
                    .when("cgpa", ">=", 3.7)
                    .when("co_curricular_score", ">=", 80)
                    .when("family_income", "<=", 8000)
                    .when("disciplinary_actions", "==", 0)
                    .then("AWARD FULL", "Excellent academic & co-curricular performance, with acceptable need")
                    .build(),
            Rule.builder("Low CGPA not eligible")
                    .priority(95)
                    .when("cgpa", "<", 2.5)
                    .then("REJECT", "CGPA below minimum scholarship requirement")
                    .build(),
            Rule.builder("Serious disciplinary record")
                    .priority(90)
                    .when("disciplinary_actions", ">=", 2)
                    .then("REJECT", "Too many disciplinary records")
                    .build(),
            Rule.builder("Good candidate partial scholarship")
                    .priority(80)
                    .when("cgpa", ">=", 3.3)
                    .when("co_curricular_score", ">=", 60)
                    .when("family_income", "<=", 12000)
                    .when("disciplinary_actions", "<=", 1)
                    .then("AWARD PARTIAL", "Good academic & involvement record with moderate need")
                    .build(),
            Rule.builder("Need-based review")
                    .priority(70)
                    .when("cgpa", ">=", 2.5)
                    .when("family_income", "<=", 4000)
                    .then("REVIEW", "High need but borderline academic score")
                    .build(),
            Rule.builder("Default non-qualifier")
                    .priority(1)
                    .then("NOT ELIGIBLE", "Applicant did not meet the criteria for any defined scholarship or review.")
                    .build()));

    private DefaultRuleSets() {
        throw new AssertionError("No instances");
    }

    /**
     * The university scholarship rules. Facts: {@code cgpa}, {@code co_curricular_score},
     * {@code family_income}, {@code disciplinary_actions}.
     */
    public static RuleSet scholarship() {
        return SCHOLARSHIP;
    }

    public static boolean isDefault(RuleSet ruleSet) {
        return ruleSet != null && SOURCE.equals(ruleSet.source());
    }
}
