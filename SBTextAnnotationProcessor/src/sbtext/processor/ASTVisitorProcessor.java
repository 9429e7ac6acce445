package sbtext.processor;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.PackageElement;
import javax.lang.model.element.TypeElement;
import javax.tools.Diagnostic.Kind;
import javax.tools.FileObject;
import javax.tools.JavaFileObject;
import javax.tools.StandardLocation;

import com.google.auto.service.AutoService;
import com.google.common.collect.ImmutableSet;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import com.squareup.javapoet.TypeVariableName;

/**
 * Generates the visitor plumbing for the SBText syntax tree.
 *
 * <p>For every {@link ASTNode} class an {@code X_ASTNode} interface is written with default {@code
 * accept} and {@code visitChildren} methods; the latter walks each {@link ASTChild} accessor in
 * declaration order. Once all rounds are over, {@code ASTVisitor}, {@code DefaultASTVisitor} and
 * {@code VoidDefaultASTVisitor} are written with one overload per node class.
 */
@AutoService(Processor.class)
public class ASTVisitorProcessor extends AbstractProcessor {

  private static final String DEFAULT_PACKAGE = "sbtext";
  private static final String NODE_LIST_RESOURCE = "META-INF/astNodes/list.txt";

  @Override
  public SourceVersion getSupportedSourceVersion() {
    return SourceVersion.latestSupported();
  }

  @Override
  public ImmutableSet<String> getSupportedAnnotationTypes() {
    return ImmutableSet.of(ASTNode.class.getName(), ASTChild.class.getName());
  }

  private final Set<String> allAstNodes = new TreeSet<>();
  private String astPackage = null;

  @Override
  public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
    try {
      if (roundEnv.processingOver()) {
        if (astPackage != null) {
          generateASTVisitorFiles();
        }
      } else if (!annotations.isEmpty()) {
        processImpl(roundEnv);
      }
    } catch (IOException ex) {
      throw new RuntimeException(ex);
    }

    return true;
  }

  // Merges the node list recorded by an earlier (incremental) compile, then rewrites it.
  private void syncNodeList() throws IOException {
    FileObject file;
    try {
      file =
          processingEnv
              .getFiler()
              .getResource(StandardLocation.CLASS_OUTPUT, "", NODE_LIST_RESOURCE);
      try (BufferedReader br =
          new BufferedReader(
              new InputStreamReader(file.openInputStream(), StandardCharsets.UTF_8))) {
        String line;
        while ((line = br.readLine()) != null) {
          line = line.trim();
          if (!line.isEmpty() && line.startsWith(astPackage + ".")) {
            allAstNodes.add(line);
          }
        }
      }
    } catch (IOException | IllegalArgumentException notYetWritten) {
      file =
          processingEnv
              .getFiler()
              .createResource(StandardLocation.CLASS_OUTPUT, "", NODE_LIST_RESOURCE);
    }

    try (Writer wr = file.openWriter()) {
      wr.append(allAstNodes.stream().collect(Collectors.joining("\n", "", "\n")));
    }
  }

  @FunctionalInterface
  private static interface TypeRenderer {
    String renderType(String typeName);
  }

  private void writeFile(String name, String format, TypeRenderer typeRenderer) throws IOException {
    JavaFileObject file = processingEnv.getFiler().createSourceFile(astPackage + "." + name);
    try (Writer wr = file.openWriter()) {
      wr.append(
          String.format(
              format,
              astPackage,
              allAstNodes
                  .stream()
                  .map(typeRenderer::renderType)
                  .collect(Collectors.joining("\n\n"))));
    }
  }

  private void generateASTVisitorFiles() throws IOException {
    syncNodeList();

    writeFile(
        "ASTVisitor",
        "package %s;\n\ninterface ASTVisitor<V> {\n\n%s\n\n}\n",
        typeName -> String.format("  V visit(%s node, V value);", typeName));
    writeFile(
        "DefaultASTVisitor",
        "package %s;\n\n"
            + "public abstract class DefaultASTVisitor<V> implements ASTVisitor<V> {\n\n"
            + "%s\n\n}\n",
        typeName ->
            String.format(
                "  @Override\n"
                    + "  public V visit(%s node, V value) {\n"
                    + "    return node.visitChildren(this, value);\n"
                    + "  }",
                typeName));
    writeFile(
        "VoidDefaultASTVisitor",
        "package %s;\n\n"
            + "public abstract class VoidDefaultASTVisitor extends DefaultASTVisitor<Void> {\n\n"
            + "%s\n\n}\n",
        typeName ->
            String.format(
                "  @Override\n"
                    + "  public final Void visit(%s node, Void value) {\n"
                    + "    visitImpl(node);\n"
                    + "    return null;\n"
                    + "  }\n\n"
                    + "  public void visitImpl(%s node) {\n"
                    + "    node.visitChildren(this, null);\n"
                    + "  }",
                typeName, typeName));
  }

  // Statement.Loop -> Statement_Loop_ASTNode
  private static String getASTNodeClassName(Element element) {
    Deque<String> elems = new ArrayDeque<>();
    elems.push("ASTNode");
    do {
      if (element.getKind() == ElementKind.CLASS) {
        elems.addFirst(element.getSimpleName().toString());
      }
      element = element.getEnclosingElement();
    } while (element.getKind() != ElementKind.PACKAGE);
    return String.join("_", elems);
  }

  private static final TypeVariableName V = TypeVariableName.get("V");

  private MethodSpec.Builder visitorMethod(String name) {
    return MethodSpec.methodBuilder(name)
        .addAnnotation(Override.class)
        .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
        .addTypeVariable(V)
        .returns(V)
        .addParameter(
            ParameterSpec.builder(
                    ParameterizedTypeName.get(ClassName.get(astPackage, "ASTVisitor"), V),
                    "visitor")
                .build())
        .addParameter(ParameterSpec.builder(V, "value").build());
  }

  private void writeASTNodeFile(TypeElement element) throws IOException {
    String interfaceName = getASTNodeClassName(element);
    if (element
        .getInterfaces()
        .stream()
        .noneMatch(i -> TypeName.get(i).toString().endsWith(interfaceName))) {
      processingEnv
          .getMessager()
          .printMessage(Kind.ERROR, "Missing interface: " + interfaceName, element);
      return;
    }

    TypeSpec.Builder typeSpecBuilder =
        TypeSpec.interfaceBuilder(interfaceName)
            .addModifiers(Modifier.PUBLIC)
            .addSuperinterface(ClassName.get(astPackage, "ASTNodeInterface"));

    typeSpecBuilder.addMethod(
        visitorMethod("accept")
            .addStatement(
                "return visitor.visit(($L) this, value)", element.getQualifiedName().toString())
            .build());

    MethodSpec.Builder visitChildrenMethodBuilder = visitorMethod("visitChildren");
    for (Element maybeMethod : element.getEnclosedElements()) {
      if (maybeMethod.getKind() != ElementKind.METHOD) continue;
      if (maybeMethod.getAnnotation(ASTChild.class) == null) continue;
      if (maybeMethod.getAnnotation(Override.class) == null) {
        processingEnv.getMessager().printMessage(Kind.ERROR, "Missing @Override", maybeMethod);
      }

      ExecutableElement method = (ExecutableElement) maybeMethod;
      typeSpecBuilder.addMethod(
          MethodSpec.methodBuilder(method.getSimpleName().toString())
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(TypeName.get(method.getReturnType()))
              .build());

      visitChildrenMethodBuilder.addStatement(
          "value = $T.accept($L(), visitor, value)",
          ClassName.get(astPackage, "ASTNodeUtils"),
          method.getSimpleName().toString());
    }
    typeSpecBuilder.addMethod(visitChildrenMethodBuilder.addStatement("return value").build());

    JavaFile javaFile = JavaFile.builder(astPackage, typeSpecBuilder.build()).build();
    JavaFileObject file =
        processingEnv.getFiler().createSourceFile(astPackage + "." + interfaceName, element);
    try (Writer wr = file.openWriter()) {
      wr.append(javaFile.toString());
    }
  }

  private void processImpl(RoundEnvironment roundEnv) throws IOException {
    for (Element element : roundEnv.getElementsAnnotatedWith(ASTNode.class)) {
      TypeElement typeElement = (TypeElement) element;
      String elementPackage = packageOf(typeElement);
      if (astPackage == null) {
        astPackage = elementPackage.isEmpty() ? DEFAULT_PACKAGE : elementPackage;
      } else if (!astPackage.equals(elementPackage)) {
        processingEnv
            .getMessager()
            .printMessage(
                Kind.ERROR, "All AST nodes must live in package '" + astPackage + "'", element);
        continue;
      }

      try {
        writeASTNodeFile(typeElement);
      } catch (Exception ex) {
        processingEnv.getMessager().printMessage(Kind.ERROR, "APT Error: " + ex, typeElement);
      }

      String wildcards = "";
      if (!typeElement.getTypeParameters().isEmpty()) {
        wildcards =
            typeElement
                .getTypeParameters()
                .stream()
                .map(p -> "?")
                .collect(Collectors.joining(", ", "<", ">"));
      }
      allAstNodes.add(typeElement.getQualifiedName().toString() + wildcards);
    }
  }

  private String packageOf(TypeElement element) {
    PackageElement pkg = processingEnv.getElementUtils().getPackageOf(element);
    return pkg.getQualifiedName().toString();
  }
}
