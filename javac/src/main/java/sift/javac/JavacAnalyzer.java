//
// Sift - collecting type members for completion and suggestions
// http://github.com/scaled/codex/blob/master/LICENSE

package sift.javac;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import com.sun.source.util.JavacTask;
import java.io.File;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import javax.tools.Diagnostic;
import javax.tools.DiagnosticListener;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;

/**
 * Analyzes Java source code with the standard Java compiler and exposes the result as a {@link
 * JavacModel}. This parses and attributes the code, but stops short of generating bytecode.
 */
public class JavacAnalyzer {

  public JavacAnalyzer () {
    this(ToolProvider.getSystemJavaCompiler());
  }

  public JavacAnalyzer (JavaCompiler compiler) {
    Preconditions.checkState(compiler != null, "No system Java compiler (running on a JRE?)");
    _compiler = compiler;
  }

  /** Provides the classpath used by the compiler. */
  public Iterable<Path> classpath () { return Collections.emptyList(); }

  /** Analyzes all .java source files in {@code files}. */
  public JavacModel analyze (Iterable<Path> files) {
    StandardJavaFileManager fm = _compiler.getStandardFileManager(null, null, null);
    return analyze0(fm.getJavaFileObjectsFromFiles(Iterables.transform(files, Path::toFile)));
  }

  /** Combines {@code file} and {@code code} into a test file and analyzes it. */
  public JavacModel analyze (String file, String code) {
    return analyze(Collections.singletonList(file), Collections.singletonList(code));
  }

  /** Combines {@code files} and {@code codes} into test files and analyzes them together. */
  public JavacModel analyze (Iterable<String> files, Iterable<String> codes) {
    List<JavaFileObject> objs = Lists.newArrayList();
    Iterator<String> citer = codes.iterator();
    for (String file : files) objs.add(mkTestObject(file, citer.next()));
    return analyze0(objs);
  }

  private JavacModel analyze0 (Iterable<? extends JavaFileObject> files) {
    List<String> opts = Lists.newArrayList("-proc:none");

    String cp = Joiner.on(File.pathSeparator).join(classpath());
    if (cp.length() > 0) {
      opts.add("-classpath");
      opts.add(cp);
    }

    int[] diags = new int[Diagnostic.Kind.values().length];
    DiagnosticListener<JavaFileObject> diag = new DiagnosticListener<JavaFileObject>() {
      public void report (Diagnostic<? extends JavaFileObject> diagnostic) {
        diags[diagnostic.getKind().ordinal()]++;
      }
    };
    JavacTask task = (JavacTask)_compiler.getTask(null, null, diag, opts, null, files);
    try {
      task.parse();
      task.analyze();
    } catch (IOException e) {
      throw new RuntimeException(e);
    }

    // report the number of diagnostics
    StringBuilder sb = new StringBuilder();
    for (Diagnostic.Kind kind : Diagnostic.Kind.values()) {
      int count = diags[kind.ordinal()];
      if (count == 0) continue;
      if (sb.length() > 0) sb.append(", ");
      sb.append(kind.toString().toLowerCase()).append('=').append(count);
    }
    if (sb.length() > 0) System.err.println("Diagnostics [" + sb + "]");

    return new JavacModel(task);
  }

  private JavaFileObject mkTestObject (String file, String code) {
    return new SimpleJavaFileObject(URI.create("test:/" + file), JavaFileObject.Kind.SOURCE) {
      @Override public CharSequence getCharContent (boolean ignoreEncodingErrors) {
        return code;
      }
    };
  }

  private final JavaCompiler _compiler;
}
