package org.dgflux.otCompiler.compiler.visitors.inner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dgflux.otCompiler.compiler.OTCompiler;
import org.dgflux.otCompiler.compiler.errors.InternalCompilerError;
import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.ir.expression.OTBoundaryNormalComponent;
import org.dgflux.otCompiler.ir.expression.OTBoundaryPair;
import org.dgflux.otCompiler.ir.expression.OTCallExpression;
import org.dgflux.otCompiler.ir.expression.OTCommonSubexpression;
import org.dgflux.otCompiler.ir.expression.OTComparisonExpression;
import org.dgflux.otCompiler.ir.expression.OTConstant;
import org.dgflux.otCompiler.ir.expression.OTExpression;
import org.dgflux.otCompiler.ir.expression.OTFluxExchange;
import org.dgflux.otCompiler.ir.expression.OTGeometricFactor;
import org.dgflux.otCompiler.ir.expression.OTIfExpression;
import org.dgflux.otCompiler.ir.expression.OTIfPositiveExpression;
import org.dgflux.otCompiler.ir.expression.OTNaryExpression;
import org.dgflux.otCompiler.ir.expression.OTNodeCoordinateComponent;
import org.dgflux.otCompiler.ir.expression.OTNormal;
import org.dgflux.otCompiler.ir.expression.OTOnes;
import org.dgflux.otCompiler.ir.expression.OTOperatorBinding;
import org.dgflux.otCompiler.ir.expression.OTPowerExpression;
import org.dgflux.otCompiler.ir.expression.OTQuotientExpression;
import org.dgflux.otCompiler.ir.expression.OTScalarParameter;
import org.dgflux.otCompiler.ir.expression.OTSubscriptExpression;
import org.dgflux.otCompiler.ir.expression.OTVariable;
import org.dgflux.otCompiler.ir.expression.OTVectorExpression;
import org.dgflux.otCompiler.ir.expression.OTWholeDomainFlux;
import org.dgflux.otCompiler.ir.operator.OTFluxOperatorBase;
import org.dgflux.util.Utilities;

import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Serializes an operator template as a Jackson tree.
 * Every node becomes an object with a "class" field.  A common subexpression is
 * serialized in full the first time it is reached, and as
 * {"class": "OTCommonSubexpression", "ref": id} afterwards. */
public class ToJsonInnerVisitor extends InnerVisitor {
    final ObjectMapper mapper;
    final Map<OTCommonSubexpression, Integer> cseIds;
    @Nullable
    JsonNode result;

    public ToJsonInnerVisitor(OTCompiler compiler) {
        super(compiler);
        this.mapper = Utilities.deterministicObjectMapper();
        this.cseIds = new LinkedHashMap<>();
        this.result = null;
    }

    public JsonNode toJson(OTExpression expression) {
        this.startVisit(expression);
        this.cseIds.clear();
        JsonNode json = this.rec(expression);
        this.endVisit();
        return json;
    }

    JsonNode rec(OTExpression expression) {
        this.result = null;
        expression.accept(this);
        JsonNode json = this.result;
        if (json == null)
            throw new InternalCompilerError("No JSON produced for " + expression, expression);
        return json;
    }

    ArrayNode list(List<? extends OTExpression> expressions) {
        ArrayNode array = this.mapper.createArrayNode();
        for (OTExpression expression: expressions)
            array.add(this.rec(expression));
        return array;
    }

    ObjectNode object(OTExpression expression) {
        ObjectNode node = this.mapper.createObjectNode();
        node.put("class", expression.getClass().getSimpleName());
        return node;
    }

    VisitDecision produce(JsonNode json) {
        this.result = json;
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(OTExpression expression) {
        throw new InternalCompilerError("No JSON encoding for " + expression, expression);
    }

    @Override
    public VisitDecision preorder(OTNaryExpression expression) {
        ObjectNode node = this.object(expression);
        node.set("children", this.list(expression.children));
        return this.produce(node);
    }

    @Override
    public VisitDecision preorder(OTQuotientExpression expression) {
        ObjectNode node = this.object(expression);
        node.set("numerator", this.rec(expression.numerator));
        node.set("denominator", this.rec(expression.denominator));
        return this.produce(node);
    }

    @Override
    public VisitDecision preorder(OTPowerExpression expression) {
        ObjectNode node = this.object(expression);
        node.set("base", this.rec(expression.base));
        node.set("exponent", this.rec(expression.exponent));
        return this.produce(node);
    }

    @Override
    public VisitDecision preorder(OTIfExpression expression) {
        ObjectNode node = this.object(expression);
        node.set("condition", this.rec(expression.condition));
        node.set("then", this.rec(expression.then));
        node.set("otherwise", this.rec(expression.otherwise));
        return this.produce(node);
    }

    @Override
    public VisitDecision preorder(OTIfPositiveExpression expression) {
        ObjectNode node = this.object(expression);
        node.set("criterion", this.rec(expression.criterion));
        node.set("then", this.rec(expression.then));
        node.set("otherwise", this.rec(expression.otherwise));
        return this.produce(node);
    }

    @Override
    public VisitDecision preorder(OTComparisonExpression expression) {
        ObjectNode node = this.object(expression);
        node.put("operator", expression.operator.name());
        node.set("left", this.rec(expression.left));
        node.set("right", this.rec(expression.right));
        return this.produce(node);
    }

    @Override
    public VisitDecision preorder(OTCallExpression expression) {
        ObjectNode node = this.object(expression);
        node.put("function", expression.function);
        node.set("parameters", this.list(expression.parameters));
        return this.produce(node);
    }

    @Override
    public VisitDecision preorder(OTVariable expression) {
        return this.produce(this.object(expression).put("name", expression.name));
    }

    @Override
    public VisitDecision preorder(OTSubscriptExpression expression) {
        ObjectNode node = this.object(expression);
        node.put("aggregate", expression.aggregate.name);
        node.put("index", expression.index);
        return this.produce(node);
    }

    @Override
    public VisitDecision preorder(OTConstant expression) {
        return this.produce(this.object(expression).put("value", expression.value));
    }

    @Override
    public VisitDecision preorder(OTScalarParameter expression) {
        return this.produce(this.object(expression).put("name", expression.name));
    }

    @Override
    public VisitDecision preorder(OTNormal expression) {
        return this.produce(this.object(expression).put("axis", expression.axis));
    }

    @Override
    public VisitDecision preorder(OTBoundaryNormalComponent expression) {
        ObjectNode node = this.object(expression);
        node.put("tag", expression.tag.name());
        node.put("axis", expression.axis);
        node.put("quadratureTag", expression.quadratureTag);
        return this.produce(node);
    }

    @Override
    public VisitDecision preorder(OTNodeCoordinateComponent expression) {
        ObjectNode node = this.object(expression);
        node.put("axis", expression.axis);
        node.put("quadratureTag", expression.quadratureTag);
        return this.produce(node);
    }

    @Override
    public VisitDecision preorder(OTOnes expression) {
        return this.produce(this.object(expression).put("quadratureTag", expression.quadratureTag));
    }

    @Override
    public VisitDecision preorder(OTGeometricFactor expression) {
        ObjectNode node = this.object(expression);
        node.put("kind", expression.kind.name());
        node.put("xyzAxis", expression.xyzAxis);
        node.put("rstAxis", expression.rstAxis);
        return this.produce(node);
    }

    @Override
    public VisitDecision preorder(OTFluxExchange expression) {
        ObjectNode node = this.object(expression);
        node.put("index", expression.index);
        node.put("rank", expression.rank);
        node.set("argFields", this.list(expression.argFields));
        return this.produce(node);
    }

    @Override
    public VisitDecision preorder(OTCommonSubexpression expression) {
        ObjectNode node = this.object(expression);
        Integer id = this.cseIds.get(expression);
        if (id != null)
            return this.produce(node.put("ref", id));
        id = this.cseIds.size();
        this.cseIds.put(expression, id);
        node.put("id", id);
        node.put("prefix", expression.prefix);
        node.set("child", this.rec(expression.child));
        return this.produce(node);
    }

    @Override
    public VisitDecision preorder(OTOperatorBinding expression) {
        ObjectNode node = this.object(expression);
        ObjectNode operator = node.putObject("operator");
        operator.put("class", expression.operator.getClass().getSimpleName());
        operator.put("family", expression.operator.family().name());
        operator.put("text", expression.operator.toString());
        OTFluxOperatorBase flux = expression.operator.as(OTFluxOperatorBase.class);
        if (flux != null)
            operator.put("flux", flux.flux.toString());
        node.set("field", this.rec(expression.field));
        return this.produce(node);
    }

    @Override
    public VisitDecision preorder(OTBoundaryPair expression) {
        ObjectNode node = this.object(expression);
        node.set("volumeFields", this.list(expression.volumeFields));
        node.set("boundaryFields", this.list(expression.boundaryFields));
        node.put("tag", expression.tag.name());
        return this.produce(node);
    }

    @Override
    public VisitDecision preorder(OTVectorExpression expression) {
        ObjectNode node = this.object(expression);
        node.set("components", this.list(expression.components));
        return this.produce(node);
    }

    @Override
    public VisitDecision preorder(OTWholeDomainFlux expression) {
        ObjectNode node = this.object(expression);
        node.set("interiors", this.list(expression.interiors));
        node.set("boundaries", this.list(expression.boundaries));
        node.put("isLift", expression.isLift);
        return this.produce(node);
    }

    @Override
    public String toString() {
        return "ToJsonInnerVisitor " + this.id;
    }
}
