package io.formulakit.core.engine;

import io.formulakit.core.error.FormulaNotFoundException;
import io.formulakit.core.error.FormulaParseException;
import io.formulakit.core.model.Formula;
import io.formulakit.core.model.FormulaDefinition;
import io.formulakit.core.parser.FormulaParser;
import io.formulakit.core.spi.FormulaListener;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiled formulas keyed by id. Expressions are parsed once at registration and evaluated many
 * times through {@link FormulaRunner}.
 *
 * <p>
 * Thread-safe: registration, lookup and removal can happen concurrently. Re-registering an id
 * replaces the previous formula (last-write-wins).
 */
public final class FormulaRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(FormulaRegistry.class);

    private final Map<String, Formula> formulas = new ConcurrentHashMap<>();
    private final FormulaParser parser;
    private final FormulaListener listener;

    /** Creates a registry with a default parser and no listener. */
    public FormulaRegistry() {
        this(new FormulaParser(), FormulaListener.NOOP);
    }

    public FormulaRegistry(FormulaParser parser) {
        this(parser, FormulaListener.NOOP);
    }

    /**
     * @param parser   parser used for every registration
     * @param listener receives registration and evaluation events; may be null
     */
    public FormulaRegistry(FormulaParser parser, FormulaListener listener) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.listener = listener != null ? listener : FormulaListener.NOOP;
    }

    /**
     * Parses and stores an expression. A parse failure is logged and reported to the listener; the
     * registry keeps any formula previously stored under the id.
     *
     * @return {@code true} if the expression parsed and was stored
     * @throws IllegalArgumentException if id is null or blank
     */
    public boolean register(String id, String expression) {
        try {
            registerOrThrow(id, expression);
            return true;
        } catch (FormulaParseException e) {
            return false;
        }
    }

    /**
     * Parses and stores an expression, propagating parse failures.
     *
     * @return the stored formula
     * @throws FormulaParseException    if the expression violates the grammar
     * @throws IllegalArgumentException if id is null or blank
     */
    public Formula registerOrThrow(String id, String expression) {
        requireId(id);
        Objects.requireNonNull(expression, "expression must not be null");
        Formula formula;
        try {
            formula = parser.parse(id, expression);
        } catch (FormulaParseException e) {
            LOG.warn(
                    "formula.rejected id={} kind={} line={} column={} reason={}",
                    id,
                    e.kind(),
                    e.line(),
                    e.column(),
                    e.reason());
            notifyRejected(id, e.getMessage());
            throw e;
        }
        formulas.put(id, formula);
        LOG.debug("formula.registered id={} inputs={}", id, formula.requiredInputs());
        notifyRegistered(id, formula);
        return formula;
    }

    /**
     * Registers each definition, skipping those that fail to parse.
     *
     * @return the number of definitions registered
     */
    public int registerAll(Collection<FormulaDefinition> definitions) {
        int count = 0;
        for (FormulaDefinition definition : definitions) {
            if (register(definition.id(), definition.expression())) {
                count++;
            }
        }
        return count;
    }

    public Optional<Formula> find(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(formulas.get(id));
    }

    /**
     * Looks up a formula by id, throwing if not found.
     *
     * @throws FormulaNotFoundException if no formula is registered under the id
     */
    public Formula require(String id) {
        return find(id).orElseThrow(() -> new FormulaNotFoundException(id));
    }

    public boolean contains(String id) {
        return id != null && formulas.containsKey(id);
    }

    /** Required inputs of the formula, or an empty set when the id is unknown. */
    public Set<String> requiredInputs(String id) {
        return find(id).map(Formula::requiredInputs).orElse(Set.of());
    }

    /** Source text of the formula, or empty when the id is unknown. */
    public Optional<String> expression(String id) {
        return find(id).map(Formula::expression);
    }

    /** Registered ids in natural order. */
    public List<String> ids() {
        List<String> ids = new ArrayList<>(formulas.keySet());
        Collections.sort(ids);
        return Collections.unmodifiableList(ids);
    }

    public int size() {
        return formulas.size();
    }

    /** @return {@code true} if a formula was removed */
    public boolean remove(String id) {
        return id != null && formulas.remove(id) != null;
    }

    /** Removes every formula. */
    public void clear() {
        int count = formulas.size();
        formulas.clear();
        LOG.info("registry.cleared count={}", count);
        notifyCleared(count);
    }

    /** The listener events are reported to; {@link FormulaListener#NOOP} when none was given. */
    FormulaListener listener() {
        return listener;
    }

    private static void requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("formula id must not be null or blank");
        }
    }

    // --- Listener notification helpers ---
    // Listener exceptions are caught and logged; they never affect registration.

    private void notifyRegistered(String id, Formula formula) {
        try {
            listener.onFormulaRegistered(new FormulaListener.FormulaRegisteredEvent(
                    id, formula.expression(), formula.requiredInputs()));
        } catch (Exception e) {
            LOG.warn("FormulaListener.onFormulaRegistered failed", e);
        }
    }

    private void notifyRejected(String id, String errorDetail) {
        try {
            listener.onFormulaRejected(new FormulaListener.FormulaRejectedEvent(id, errorDetail));
        } catch (Exception e) {
            LOG.warn("FormulaListener.onFormulaRejected failed", e);
        }
    }

    private void notifyCleared(int count) {
        try {
            listener.onRegistryCleared(new FormulaListener.RegistryClearedEvent(count));
        } catch (Exception e) {
            LOG.warn("FormulaListener.onRegistryCleared failed", e);
        }
    }
}
