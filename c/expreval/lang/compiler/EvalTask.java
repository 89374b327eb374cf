// ex: se sts=4 sw=4 expandtab:

/*
 * Expression compiler - Ant task.
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
import org.apache.tools.ant.Task;

/**
 * Evaluates an arithmetic expression into an Ant property.
 *
 * <pre>
 * &lt;taskdef name="eval" classname="expreval.lang.compiler.EvalTask"/&gt;
 * &lt;eval property="threads" expression="2 * 4 + 1"/&gt;
 * </pre>
 */
public class EvalTask extends Task {
    private String expression;
    private String property;
    private String destDir;

    public void setExpression(String expression) {
        this.expression = expression;
    }

    // nested text can be used instead of the attribute
    public void addText(String text) {
        text = getProject().replaceProperties(text).trim();
        if (text.length() != 0)
            expression = text;
    }

    public void setProperty(String property) {
        this.property = property;
    }

    public void setDestDir(String dir) {
        destDir = dir;
    }

    public void execute() {
        if (expression == null)
            throw new BuildException("expression is required", getLocation());
        if (property == null)
            throw new BuildException("property is required", getLocation());
        ExpressionCompiler compiler = new ExpressionCompiler() {
            protected void warn(Diagnostic diagnostic) {
                log(diagnostic.toString(), Project.MSG_ERR);
            }
        };
        compiler.setSourceName(getTaskName());
        if (destDir != null)
            compiler.setClassDumpDir(destDir);
        double result;
        try {
            result = compiler.evaluate(expression);
        } catch (CompileException ex) {
            throw new BuildException(ex.getMessage(), ex, getLocation());
        }
        log(expression + " = " + result, Project.MSG_VERBOSE);
        getProject().setNewProperty(property, String.valueOf(result));
    }
}
