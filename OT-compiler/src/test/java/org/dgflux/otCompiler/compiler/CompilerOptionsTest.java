package org.dgflux.otCompiler.compiler;

import org.dgflux.otCompiler.compiler.errors.CompilationError;
import org.junit.Assert;
import org.junit.Test;

public class CompilerOptionsTest {
    @Test
    public void defaults() {
        CompilerOptions options = CompilerOptions.parse();
        Assert.assertEquals(CompilerOptions.getDefault(), options);
        Assert.assertTrue(options.languageOptions.checkFinalTypes());
        Assert.assertTrue(options.languageOptions.simplifyFluxes());
        Assert.assertFalse(options.languageOptions.throwOnError);
        Assert.assertEquals("", options.diff(CompilerOptions.getDefault()));
    }

    @Test
    public void parseFlags() {
        CompilerOptions options = CompilerOptions.parse(
                "--throw", "--noFinalCheck", "--noFluxSimplify", "-je", "-q", "-TTypeInference=2");
        Assert.assertTrue(options.languageOptions.throwOnError);
        Assert.assertFalse(options.languageOptions.checkFinalTypes());
        Assert.assertFalse(options.languageOptions.simplifyFluxes());
        Assert.assertTrue(options.ioOptions.emitJsonErrors);
        Assert.assertTrue(options.ioOptions.quiet);
        Assert.assertEquals("2", options.ioOptions.loggingLevel.get("TypeInference"));
    }

    @Test
    public void diff() {
        CompilerOptions options = CompilerOptions.parse("--noFluxSimplify", "--je");
        String diff = options.diff(CompilerOptions.getDefault());
        Assert.assertTrue(diff.contains("simplifyFluxes=false!=true"));
        Assert.assertTrue(diff.contains("emitJsonErrors=true!=false"));
        Assert.assertFalse(diff.contains("throwOnError"));
        Assert.assertNotEquals(CompilerOptions.getDefault(), options);
    }

    @Test
    public void unknownOption() {
        Assert.assertThrows(CompilationError.class, () -> CompilerOptions.parse("--optimize"));
    }
}
