package com.ryuqq.batchexec.testkit.contract;

import com.ryuqq.batchexec.core.attribute.AttributeKind;
import com.ryuqq.batchexec.core.attribute.AttributeRegistry;
import com.ryuqq.batchexec.core.attribute.Attributed;
import org.slf4j.LoggerFactory;

/**
 * Minimal {@link Attributed} fixture for tests.
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * SimpleAttributed target = new SimpleAttributed("Target")
 *         .with("state", AttributeKind.ANY, null)
 *         .with("locked", AttributeKind.ANY, "x");
 * target.attributes().ro("locked");
 * </pre>
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
public final class SimpleAttributed implements Attributed {

    private final AttributeRegistry attributes;

    /**
     * Creates a fixture with an empty registry.
     *
     * @param ownerClass the owner type name recorded on each attribute
     */
    public SimpleAttributed(String ownerClass) {
        this.attributes = new AttributeRegistry(ownerClass, LoggerFactory.getLogger(SimpleAttributed.class));
    }

    /**
     * Defines an attribute whose value and default are equal.
     *
     * @param name the attribute name
     * @param kind the attribute kind
     * @param value the value and default
     * @return this fixture
     */
    public SimpleAttributed with(String name, AttributeKind kind, Object value) {
        attributes.define(name, kind, value, value);
        return this;
    }

    @Override
    public AttributeRegistry attributes() {
        return attributes;
    }
}
