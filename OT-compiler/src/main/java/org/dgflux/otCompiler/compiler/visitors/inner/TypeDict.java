package org.dgflux.otCompiler.compiler.visitors.inner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dgflux.otCompiler.compiler.errors.IncompleteInferenceError;
import org.dgflux.otCompiler.ir.expression.OTExpression;
import org.dgflux.otCompiler.ir.type.NoType;
import org.dgflux.otCompiler.ir.type.TypeInfo;
import org.dgflux.util.IWritesLogs;
import org.dgflux.util.Utilities;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Current best-known type of each expression of a template.
 * Writes only ever add information: the stored type is unified with the
 * written one.  Writes that change an entry set the "changed" flag,
 * which drives the fixpoint loop of {@link TypeInference}.
 */
public class TypeDict implements IWritesLogs {
    final Map<OTExpression, TypeInfo> types;
    boolean changed;
    /** Number of entries that were created or refined. */
    int changeCount;
    /** Number of outer fixpoint iterations performed to compute this dictionary. */
    int iterations;

    public TypeDict(Map<OTExpression, TypeInfo> hints) {
        this.types = new LinkedHashMap<>(hints);
        this.changed = false;
        this.changeCount = 0;
        this.iterations = 0;
    }

    public TypeDict() {
        this(Map.of());
    }

    /** The type known for 'expression'; {@link NoType} if nothing is known. */
    public TypeInfo get(OTExpression expression) {
        TypeInfo result = this.types.get(expression);
        if (result == null)
            return new NoType();
        return result;
    }

    public void set(OTExpression expression, TypeInfo type) {
        if (type.is(NoType.class))
            return;
        TypeInfo old = this.types.get(expression);
        TypeInfo result = old == null ? type : old.unify(type, expression);
        if (result.equals(old))
            return;
        this.types.put(expression, result);
        this.changed = true;
        this.changeCount++;
        this.log(2)
                .append(expression)
                .append(": ")
                .append(old == null ? "-" : old.toString())
                .append(" -> ")
                .append(result.toString())
                .newline();
    }

    public boolean isChanged() {
        return this.changed;
    }

    public void clearChanged() {
        this.changed = false;
    }

    public void markChanged() {
        this.changed = true;
    }

    public int getChangeCount() {
        return this.changeCount;
    }

    public int getIterations() {
        return this.iterations;
    }

    public int size() {
        return this.types.size();
    }

    public boolean contains(OTExpression expression) {
        return this.types.containsKey(expression);
    }

    public Map<OTExpression, TypeInfo> asMap() {
        return Collections.unmodifiableMap(this.types);
    }

    /** Check that every recorded type is final.
     * @throws IncompleteInferenceError for the first entry which is not. */
    public void checkFinal() {
        for (Map.Entry<OTExpression, TypeInfo> entry: this.types.entrySet()) {
            if (!entry.getValue().isFinal())
                throw new IncompleteInferenceError(entry.getKey(), entry.getValue());
        }
    }

    public ArrayNode toJson(ObjectMapper mapper) {
        ArrayNode result = mapper.createArrayNode();
        for (Map.Entry<OTExpression, TypeInfo> entry: this.types.entrySet()) {
            ObjectNode node = result.addObject();
            node.put("expression", entry.getKey().toString());
            node.set("type", entry.getValue().toJson(mapper));
        }
        return result;
    }

    public String toJsonString() {
        return this.toJson(Utilities.deterministicObjectMapper()).toPrettyString();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append("TypeDict{");
        for (Map.Entry<OTExpression, TypeInfo> entry: this.types.entrySet())
            builder.append(System.lineSeparator())
                    .append("\t")
                    .append(entry.getKey())
                    .append(": ")
                    .append(entry.getValue());
        return builder.append("}").toString();
    }
}
