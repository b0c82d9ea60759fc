package org.dgflux.otCompiler.compiler.visitors.inner;

import com.fasterxml.jackson.databind.JsonNode;
import org.dgflux.otCompiler.compiler.OTTestBase;
import org.dgflux.otCompiler.ir.expression.OTCommonSubexpression;
import org.dgflux.otCompiler.ir.expression.OTConstant;
import org.dgflux.otCompiler.ir.expression.OTExpression;
import org.dgflux.otCompiler.ir.expression.OTVariable;
import org.junit.Assert;
import org.junit.Test;

public class ToJsonInnerVisitorTest extends OTTestBase {
    @Test
    public void leavesAndArithmetic() {
        OTVariable u = var("u");
        JsonNode json = testCompiler().toJson(u.plus(new OTConstant(2)));
        Assert.assertEquals("OTSumExpression", json.get("class").asText());
        JsonNode children = json.get("children");
        Assert.assertEquals(2, children.size());
        Assert.assertEquals("u", children.get(0).get("name").asText());
        Assert.assertEquals(2.0, children.get(1).get("value").asDouble(), 0.0);
    }

    @Test
    public void boundaryFlux() {
        OTVariable u = var("u");
        JsonNode json = testCompiler().toJson(fluxOnBoundary(centralFlux(), u, restrict(u, WALL), WALL));
        JsonNode operator = json.get("operator");
        Assert.assertEquals("FLUX", operator.get("family").asText());
        Assert.assertTrue(operator.has("flux"));
        JsonNode pair = json.get("field");
        Assert.assertEquals("OTBoundaryPair", pair.get("class").asText());
        Assert.assertEquals("wall", pair.get("tag").asText());
        Assert.assertEquals(1, pair.get("volumeFields").size());
        Assert.assertEquals("RESTRICT_TO_BOUNDARY",
                pair.get("boundaryFields").get(0).get("operator").get("family").asText());
    }

    @Test
    public void sharedSubexpressionsAreReferenced() {
        OTCommonSubexpression c = var("u").plus(new OTConstant(1)).cse("c");
        OTExpression template = c.times(diff(c));
        JsonNode json = testCompiler().toJson(template);
        JsonNode first = json.get("children").get(0);
        Assert.assertEquals(0, first.get("id").asInt());
        Assert.assertEquals("c", first.get("prefix").asText());
        Assert.assertTrue(first.has("child"));
        JsonNode second = json.get("children").get(1).get("field");
        Assert.assertEquals(0, second.get("ref").asInt());
        Assert.assertFalse(second.has("child"));
    }
}
