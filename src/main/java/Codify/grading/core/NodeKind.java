package Codify.grading.core;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.ArrayAccessExpr;
import com.github.javaparser.ast.expr.ArrayCreationExpr;
import com.github.javaparser.ast.expr.ArrayInitializerExpr;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.WhileStmt;

import java.util.Map;

enum NodeKind {
    FOR_LOOP,
    WHILE_LOOP,
    IF,
    TERNARY,
    SWITCH_CASE,
    METHOD,
    TYPE,
    CALL,
    NEW_OBJECT,
    ARRAY_LITERAL,
    ARRAY_ACCESS,
    BINARY,
    ASSIGN,
    VARIABLE,
    PARAMETER,
    NAME,
    FIELD_ACCESS,
    IMPORT,
    BLOCK,
    // 토큰에 넣지 않는 노드 (파일/수식어)
    SCOPE_MARKER,
    OTHER;

    private static final Map<Class<? extends Node>, NodeKind> KINDS = Map.ofEntries(
            Map.entry(ForStmt.class, FOR_LOOP),
            Map.entry(ForEachStmt.class, FOR_LOOP),
            Map.entry(WhileStmt.class, WHILE_LOOP),
            Map.entry(DoStmt.class, WHILE_LOOP),
            Map.entry(IfStmt.class, IF),
            Map.entry(ConditionalExpr.class, TERNARY),
            Map.entry(SwitchEntry.class, SWITCH_CASE),
            Map.entry(MethodDeclaration.class, METHOD),
            Map.entry(ClassOrInterfaceDeclaration.class, TYPE),
            Map.entry(EnumDeclaration.class, TYPE),
            Map.entry(RecordDeclaration.class, TYPE),
            Map.entry(MethodCallExpr.class, CALL),
            Map.entry(ObjectCreationExpr.class, NEW_OBJECT),
            Map.entry(ArrayCreationExpr.class, ARRAY_LITERAL),
            Map.entry(ArrayInitializerExpr.class, ARRAY_LITERAL),
            Map.entry(ArrayAccessExpr.class, ARRAY_ACCESS),
            Map.entry(BinaryExpr.class, BINARY),
            Map.entry(AssignExpr.class, ASSIGN),
            Map.entry(VariableDeclarator.class, VARIABLE),
            Map.entry(Parameter.class, PARAMETER),
            Map.entry(NameExpr.class, NAME),
            Map.entry(FieldAccessExpr.class, FIELD_ACCESS),
            Map.entry(ImportDeclaration.class, IMPORT),
            Map.entry(BlockStmt.class, BLOCK),
            Map.entry(CompilationUnit.class, SCOPE_MARKER),
            Map.entry(Modifier.class, SCOPE_MARKER)
    );

    static NodeKind of(Node node) {
        if (node instanceof Comment) {
            return SCOPE_MARKER;
        }
        return KINDS.getOrDefault(node.getClass(), OTHER);
    }

    boolean isLoop() {
        return this == FOR_LOOP || this == WHILE_LOOP;
    }
}
