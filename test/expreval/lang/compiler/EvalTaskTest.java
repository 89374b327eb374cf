// ex: se sts=4 sw=4 expandtab:

/*
 * Expression compiler - Ant task tests.
 *
 * Copyright (c) 2007-2013 Madis Janson
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions
 * are met:
 * 1. Redistributions of source code must retain the above copyright
 *    notice, this list of conditions and the following disclaimer.
 * 2. Redistributions in binary form must reproduce the above copyright
 *    notice, this list of conditions and the following disclaimer in the
 *    documentation and/or other materials provided with the distribution.
 * 3. The name of the author may not be used to endorse or promote products
 *    derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE AUTHOR "AS IS" AND ANY EXPRESS OR
 * IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED WARRANTIES
 * OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE DISCLAIMED.
 * IN NO EVENT SHALL THE AUTHOR BE LIABLE FOR ANY DIRECT, INDIRECT,
 * INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING, BUT
 * NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE,
 * DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY
 * THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF
 * THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */
package expreval.lang.compiler;

import org.apache.tools.ant.BuildException;
import org.apache.tools.ant.Project;

import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

public class EvalTaskTest {
    private Project project;
    private EvalTask task;

    @Before
    public void setUp() {
        project = new Project();
        task = new EvalTask();
        task.setProject(project);
        task.setTaskName("eval");
    }

    @Test
    public void setsProperty() {
        task.setExpression("2+3*4");
        task.setProperty("result");
        task.execute();
        assertEquals("14.0", project.getProperty("result"));
    }

    @Test
    public void nestedTextWithProperties() {
        project.setProperty("cores", "21");
        task.addText("  ${cores} * 2\n");
        task.setProperty("threads");
        task.execute();
        assertEquals("42.0", project.getProperty("threads"));
    }

    @Test
    public void existingPropertyIsKept() {
        project.setProperty("result", "1");
        task.setExpression("5%3");
        task.setProperty("result");
        task.execute();
        assertEquals("1", project.getProperty("result"));
    }

    @Test
    public void compileErrorFailsBuild() {
        task.setExpression("(1 + 2");
        task.setProperty("result");
        try {
            task.execute();
            fail("expected BuildException");
        } catch (BuildException ex) {
            assertEquals("eval:1:7: expected ')', found end of input",
                         ex.getMessage());
            assertTrue(ex.getCause() instanceof CompileException);
        }
        assertNull(project.getProperty("result"));
    }

    @Test(expected = BuildException.class)
    public void propertyIsRequired() {
        task.setExpression("1");
        task.execute();
    }

    @Test(expected = BuildException.class)
    public void expressionIsRequired() {
        task.setProperty("result");
        task.execute();
    }
}
