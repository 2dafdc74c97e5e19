package Codify.grading.core;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

// 채점 전에 걸러야 하는 import, 호출, 객체 생성을 찾는다
public final class SafetyScanner {
    private SafetyScanner() {}

    static final List<String> DENIED_IMPORTS = List.of(
            // OS / 파일 시스템
            "java.nio.file", "java.io.File", "java.io.FileInputStream", "java.io.FileOutputStream",
            "java.io.FileReader", "java.io.FileWriter", "java.io.RandomAccessFile", "java.lang.Runtime",
            // 프로세스 실행
            "java.lang.ProcessBuilder", "java.lang.Process",
            // 네트워크
            "java.net", "javax.net", "java.rmi",
            // 임의 객체 직렬화
            "java.io.ObjectInputStream", "java.io.ObjectOutputStream", "java.beans.XMLDecoder",
            // 리플렉션 / 동적 실행 / 저수준 메모리
            "java.lang.reflect", "java.lang.invoke", "javax.script", "javax.tools",
            "sun.misc", "jdk.internal", "java.lang.foreign"
    );

    static final Set<String> DENIED_CALLS = Set.of(
            "eval", "exec", "forName", "loadClass", "defineClass", "getSystemJavaCompiler"
    );

    static final Set<String> DENIED_CONSTRUCTIONS = Set.of(
            "ProcessBuilder", "File", "FileInputStream", "FileOutputStream", "FileReader", "FileWriter",
            "RandomAccessFile", "Socket", "ServerSocket", "URLClassLoader", "ObjectInputStream"
    );

    public static List<String> scan(CompilationUnit unit) {
        List<String> violations = new ArrayList<>();
        unit.walk(Node.TreeTraversal.PREORDER, node -> {
            if (node instanceof ImportDeclaration importDeclaration) {
                String name = importDeclaration.getNameAsString();
                if (isDeniedImport(name)) {
                    violations.add("Forbidden import: " + name);
                }
            } else if (node instanceof MethodCallExpr call) {
                if (DENIED_CALLS.contains(call.getNameAsString())) {
                    violations.add("Unsafe call: " + call.getNameAsString() + "()");
                }
                // import 없이 정규화된 이름으로 쓰는 경우
                call.getScope()
                        .map(Node::toString)
                        .filter(SafetyScanner::isDeniedImport)
                        .ifPresent(scope -> violations.add("Forbidden reference: " + scope));
            } else if (node instanceof ObjectCreationExpr creation) {
                String type = creation.getType().getNameAsString();
                String qualified = creation.getType().getNameWithScope();
                if (DENIED_CONSTRUCTIONS.contains(type)) {
                    violations.add("Unsafe construction: new " + type + "()");
                } else if (isDeniedImport(qualified)) {
                    violations.add("Forbidden reference: " + qualified);
                }
            }
        });
        return violations;
    }

    static boolean isDeniedImport(String name) {
        return DENIED_IMPORTS.stream()
                .anyMatch(denied -> name.equals(denied) || name.startsWith(denied + "."));
    }
}
