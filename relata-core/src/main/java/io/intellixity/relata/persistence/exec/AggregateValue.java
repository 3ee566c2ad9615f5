package io.intellixity.relata.persistence.exec;

import io.intellixity.relata.persistence.query.AggregateFunction;
import io.intellixity.relata.persistence.query.FieldRef;

public record AggregateValue(String alias, AggregateFunction function, FieldRef field, Object value) {}
