/*
 * Copyright (c) 2025 Arbiter Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.arbiter.ruleengine.api;

import com.arbiter.ruleengine.api.exceptions.RuleSetValidationException;
import com.arbiter.ruleengine.api.model.RuleSet;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Contract for turning an external rule representation into a {@link RuleSet}.
 */
public interface IRuleSetLoader {

    /**
     * Loads rules from a file.
     *
     * @param rulesPath path to the rules file
     * @return the parsed rule set
     * @throws IOException                 if the file cannot be read
     * @throws RuleSetValidationException if the content is not a valid rule list
     */
    RuleSet load(Path rulesPath) throws IOException;

    /**
     * Parses rules from text.
     *
     * @param content the serialized rules
     * @param source  label recorded on the resulting rule set
     * @throws RuleSetValidationException if the content is not a valid rule list
     */
    RuleSet parse(String content, String source);
}
