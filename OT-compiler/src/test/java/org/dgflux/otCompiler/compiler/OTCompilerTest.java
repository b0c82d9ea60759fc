package org.dgflux.otCompiler.compiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dgflux.otCompiler.compiler.errors.AliasedDomainVariableError;
import org.dgflux.otCompiler.compiler.errors.CompilationError;
import org.dgflux.otCompiler.compiler.errors.CompilerMessages;
import org.dgflux.otCompiler.compiler.errors.TypeConflictError;
import org.dgflux.otCompiler.compiler.visitors.inner.TypeDict;
import org.dgflux.otCompiler.compiler.visitors.inner.TypeInference;
import org.dgflux.otCompiler.ir.expression.OTConstant;
import org.dgflux.otCompiler.ir.expression.OTExpression;
import org.dgflux.otCompiler.ir.expression.OTVariable;
import org.dgflux.otCompiler.ir.flux.FluxSubstitution;
import org.dgflux.otCompiler.ir.type.VolumeVector;
import org.dgflux.util.IWritesLogs;
import org.dgflux.util.Logger;
import org.junit.Assert;
import org.junit.Test;

public class OTCompilerTest extends OTTestBase implements IWritesLogs {
    @Test
    public void successfulPasses() {
        OTCompiler compiler = reportingCompiler();
        OTVariable u = var("u");
        OTExpression template = fluxOnBoundary(centralFlux(), u, restrict(u, WALL).negate(), WALL);

        TypeDict types = compiler.inferTypes(template);
        Assert.assertNotNull(types);
        Assert.assertEquals(VolumeVector.nodal(), types.get(template));

        OTExpression rewritten = compiler.rewriteBoundaryFluxes(template);
        Assert.assertNotNull(rewritten);
        Assert.assertNotEquals(template, rewritten);
        Assert.assertFalse(compiler.hasErrors());
        compiler.throwIfErrorsOccurred();
    }

    @Test
    public void errorsAreReported() {
        OTCompiler compiler = reportingCompiler();
        OTVariable u = var("u");
        Assert.assertNull(compiler.inferTypes(diff(restrict(u, WALL))));
        Assert.assertNull(compiler.rewriteBoundaryFluxes(fluxOnBoundary(centralFlux(), u, u, WALL)));

        Assert.assertTrue(compiler.hasErrors());
        Assert.assertEquals(2, compiler.messages.errorCount());
        CompilerMessages.Message first = compiler.messages.getError(0);
        Assert.assertFalse(first.warning);
        Assert.assertEquals(TypeConflictError.KIND, first.errorType);
        Assert.assertEquals(AliasedDomainVariableError.KIND, compiler.messages.getError(1).errorType);
        Assert.assertThrows(CompilationError.class, compiler::throwIfErrorsOccurred);

        compiler.messages.clear();
        Assert.assertFalse(compiler.hasErrors());
    }

    @Test
    public void errorsAreThrown() {
        OTCompiler compiler = testCompiler();
        OTVariable u = var("u");
        Assert.assertThrows(TypeConflictError.class, () -> compiler.inferTypes(diff(restrict(u, WALL))));
        Assert.assertEquals(1, compiler.messages.errorCount());
    }

    @Test
    public void jsonMessages() throws Exception {
        CompilerOptions options = CompilerOptions.parse("--je");
        OTCompiler compiler = new OTCompiler(options);
        Assert.assertNull(compiler.inferTypes(var("u").times(diff(restrict(var("v"), WALL)))));

        JsonNode messages = new ObjectMapper().readTree(compiler.messages.toString());
        Assert.assertTrue(messages.isArray());
        Assert.assertEquals(1, messages.size());
        JsonNode message = messages.get(0);
        Assert.assertFalse(message.get("warning").asBoolean());
        Assert.assertEquals(TypeConflictError.KIND, message.get("error_type").asText());
        Assert.assertFalse(message.get("message").asText().isEmpty());
        Assert.assertTrue(message.has("node"));
    }

    @Test
    public void textMessages() {
        OTCompiler compiler = reportingCompiler();
        compiler.inferTypes(diff(restrict(var("u"), WALL)));
        String text = compiler.messages.toString();
        Assert.assertTrue(text.startsWith("error: " + TypeConflictError.KIND + ": "));
    }

    @Test
    public void loggerTest() {
        StringBuilder builder = new StringBuilder();
        Appendable save = Logger.INSTANCE.setDebugStream(builder);
        Logger.INSTANCE.setLoggingLevel(OTCompilerTest.class, 1);
        this.log(1)
                .append("Logging one statement")
                .newline();
        Logger.INSTANCE.setLoggingLevel(OTCompilerTest.class, 0);
        this.log(1)
                .append("This one is not logged")
                .newline();
        Logger.INSTANCE.setDebugStream(save);
        Assert.assertEquals("Logging one statement\n", builder.toString());
    }

    // Test the -T option
    @Test
    public void loggingParameter() {
        StringBuilder builder = new StringBuilder();
        Appendable save = Logger.INSTANCE.setDebugStream(builder);
        try {
            OTCompiler compiler = new OTCompiler(CompilerOptions.parse("-TTypeInference=1"));
            Assert.assertNotNull(compiler.inferTypes(var("x").plus(new OTConstant(1))));
        } finally {
            Logger.INSTANCE.setDebugStream(save);
            Logger.INSTANCE.setLoggingLevel(TypeInference.class, 0);
        }
        Assert.assertTrue(builder.toString().contains("Type inference converged"));
    }

    @Test
    public void fluxSubstitutionLogging() {
        StringBuilder builder = new StringBuilder();
        Appendable save = Logger.INSTANCE.setDebugStream(builder);
        try {
            OTCompiler compiler = new OTCompiler(CompilerOptions.parse("-TFluxSubstitution=2"));
            OTVariable u = var("u");
            Assert.assertNotNull(compiler.rewriteBoundaryFluxes(
                    fluxOnBoundary(centralFlux(), u, restrict(u, WALL).negate(), WALL)));
        } finally {
            Logger.INSTANCE.setDebugStream(save);
            Logger.INSTANCE.setLoggingLevel(FluxSubstitution.class, 0);
        }
        Assert.assertTrue(builder.toString().contains("Substituting "));
    }

    @Test
    public void badLoggingParameter() {
        Assert.assertThrows(CompilationError.class,
                () -> new OTCompiler(CompilerOptions.parse("-TTypeInference=verbose")));
        Assert.assertThrows(CompilationError.class,
                () -> new OTCompiler(CompilerOptions.parse("-TNoSuchPass=1")));
    }
}
