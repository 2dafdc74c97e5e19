package Codify.grading.core;

import Codify.grading.model.DataStructureKind;
import Codify.grading.model.FeatureRecord;
import Codify.grading.model.PatternHint;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.ArrayAccessExpr;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

// 한 번의 pre-order 순회로 특징을 모은다. 순회마다 새 인스턴스
public final class FeatureExtractor {

    private static final Set<String> MEMO_KEYWORDS = Set.of("dp", "memo", "cache", "table");

    private static final Map<String, DataStructureKind> CREATED_TYPES = Map.ofEntries(
            Map.entry("ArrayList", DataStructureKind.SEQUENCE),
            Map.entry("LinkedList", DataStructureKind.SEQUENCE),
            Map.entry("Vector", DataStructureKind.SEQUENCE),
            Map.entry("HashMap", DataStructureKind.MAPPING),
            Map.entry("TreeMap", DataStructureKind.MAPPING),
            Map.entry("LinkedHashMap", DataStructureKind.MAPPING),
            Map.entry("Hashtable", DataStructureKind.MAPPING),
            Map.entry("ConcurrentHashMap", DataStructureKind.MAPPING),
            Map.entry("HashSet", DataStructureKind.SET),
            Map.entry("TreeSet", DataStructureKind.SET),
            Map.entry("LinkedHashSet", DataStructureKind.SET),
            Map.entry("SimpleEntry", DataStructureKind.PAIR),
            Map.entry("SimpleImmutableEntry", DataStructureKind.PAIR),
            Map.entry("ArrayDeque", DataStructureKind.DEQUE)
    );

    // List.of(...), Map.entry(...) 처럼 팩토리 메서드로 만드는 컬렉션
    private static final Map<String, DataStructureKind> FACTORY_CALLS = Map.of(
            "List.of", DataStructureKind.SEQUENCE,
            "Arrays.asList", DataStructureKind.SEQUENCE,
            "Map.of", DataStructureKind.MAPPING,
            "Map.ofEntries", DataStructureKind.MAPPING,
            "Map.entry", DataStructureKind.PAIR,
            "Set.of", DataStructureKind.SET
    );

    private int loopCount;
    private int conditionalCount;
    private int functionCount;
    private int typeCount;
    private int loopDepth;
    private int maxLoopDepth;
    private int whileDepth;
    private boolean recursion;
    private final Set<DataStructureKind> dataStructures = EnumSet.noneOf(DataStructureKind.class);
    private final Set<PatternHint> hints = EnumSet.noneOf(PatternHint.class);
    private final List<String> functionNames = new ArrayList<>();
    private final List<String> referencedNames = new ArrayList<>();
    private final List<String> nodeTokens = new ArrayList<>();
    private final Deque<String> enclosingMethods = new ArrayDeque<>();

    private FeatureExtractor() {}

    public static FeatureRecord extract(CompilationUnit unit) {
        FeatureExtractor extractor = new FeatureExtractor();
        extractor.walk(unit);
        return extractor.toRecord();
    }

    private void walk(Node node) {
        NodeKind kind = NodeKind.of(node);
        if (kind != NodeKind.SCOPE_MARKER) {
            nodeTokens.add(node.getClass().getSimpleName());
        }
        enter(kind, node);
        for (Node child : node.getChildNodes()) {
            walk(child);
        }
        exit(kind);
    }

    private void enter(NodeKind kind, Node node) {
        switch (kind) {
            case FOR_LOOP -> enterLoop();
            case WHILE_LOOP -> {
                enterLoop();
                whileDepth++;
            }
            case IF, TERNARY -> conditionalCount++;
            case SWITCH_CASE -> {
                if (!((SwitchEntry) node).getLabels().isEmpty()) conditionalCount++;
            }
            case METHOD -> {
                String name = ((MethodDeclaration) node).getNameAsString();
                functionCount++;
                functionNames.add(lower(name));
                enclosingMethods.push(name);
            }
            case TYPE -> {
                typeCount++;
                referencedNames.add(lower(((TypeDeclaration<?>) node).getNameAsString()));
            }
            case CALL -> onCall((MethodCallExpr) node);
            case NEW_OBJECT -> onObjectCreation((ObjectCreationExpr) node);
            case ARRAY_LITERAL -> dataStructures.add(DataStructureKind.SEQUENCE);
            case ARRAY_ACCESS -> {
                // arr[i][j]
                if (((ArrayAccessExpr) node).getName() instanceof ArrayAccessExpr) hints.add(PatternHint.MATRIX);
            }
            case BINARY -> {
                if (whileDepth > 0 && isHalving((BinaryExpr) node)) hints.add(PatternHint.HALVING);
            }
            case ASSIGN -> onAssign((AssignExpr) node);
            case VARIABLE -> onVariable((VariableDeclarator) node);
            case PARAMETER -> referencedNames.add(lower(((Parameter) node).getNameAsString()));
            case NAME -> referencedNames.add(lower(((NameExpr) node).getNameAsString()));
            case FIELD_ACCESS -> referencedNames.add(lower(((FieldAccessExpr) node).getNameAsString()));
            case IMPORT -> onImport((ImportDeclaration) node);
            case BLOCK -> detectSwap((BlockStmt) node);
            case SCOPE_MARKER, OTHER -> {
            }
        }
    }

    private void exit(NodeKind kind) {
        if (kind.isLoop()) loopDepth--;
        if (kind == NodeKind.WHILE_LOOP) whileDepth--;
        if (kind == NodeKind.METHOD) enclosingMethods.pop();
    }

    private void enterLoop() {
        loopCount++;
        loopDepth++;
        maxLoopDepth = Math.max(maxLoopDepth, loopDepth);
    }

    private void onCall(MethodCallExpr call) {
        String name = call.getNameAsString();
        referencedNames.add(lower(name));

        // 자기 자신을 직접 호출하는 경우만 재귀로 본다 (this.f() 포함)
        boolean unaliased = call.getScope().isEmpty() || call.getScope().get() instanceof ThisExpr;
        if (unaliased && name.equals(enclosingMethods.peek())) {
            recursion = true;
        }

        call.getScope()
                .filter(NameExpr.class::isInstance)
                .map(scope -> ((NameExpr) scope).getNameAsString() + "." + name)
                .map(FACTORY_CALLS::get)
                .ifPresent(dataStructures::add);
    }

    private void onObjectCreation(ObjectCreationExpr creation) {
        String type = creation.getType().getNameAsString();
        referencedNames.add(lower(type));
        DataStructureKind kind = CREATED_TYPES.get(type);
        if (kind != null) dataStructures.add(kind);
    }

    private void onAssign(AssignExpr assign) {
        Expression target = assign.getTarget();
        if (target instanceof NameExpr name) {
            checkMemoName(name.getNameAsString());
        } else if (target instanceof FieldAccessExpr field) {
            checkMemoName(field.getNameAsString());
        }

        if (whileDepth > 0 && isHalvingAssignment(assign)) {
            hints.add(PatternHint.HALVING);
        }
    }

    private void onVariable(VariableDeclarator variable) {
        String name = variable.getNameAsString();
        referencedNames.add(lower(name));
        if (variable.getInitializer().isPresent()) {
            checkMemoName(name);
        }
    }

    private void onImport(ImportDeclaration importDeclaration) {
        if (importDeclaration.isAsterisk()) return;
        String qualified = importDeclaration.getNameAsString();
        String simple = qualified.substring(qualified.lastIndexOf('.') + 1);
        if (simple.endsWith("Deque") || simple.endsWith("Queue") || simple.equals("LinkedList")) {
            dataStructures.add(DataStructureKind.DEQUE);
        }
    }

    private void checkMemoName(String name) {
        String lowered = lower(name);
        if (MEMO_KEYWORDS.stream().anyMatch(lowered::contains)) {
            hints.add(PatternHint.MEMO_TABLE);
        }
    }

    // t = a; a = b; b = t;
    private void detectSwap(BlockStmt block) {
        List<Statement> statements = block.getStatements();
        for (int i = 0; i + 2 < statements.size(); i++) {
            Optional<Transfer> first = transferOf(statements.get(i));
            Optional<Transfer> second = transferOf(statements.get(i + 1));
            Optional<Transfer> third = transferOf(statements.get(i + 2));
            if (first.isEmpty() || second.isEmpty() || third.isEmpty()) continue;

            if (second.get().target().equals(first.get().source())
                    && third.get().target().equals(second.get().source())
                    && third.get().source().equals(first.get().target())) {
                hints.add(PatternHint.SWAP);
                return;
            }
        }
    }

    private static Optional<Transfer> transferOf(Statement statement) {
        if (!(statement instanceof ExpressionStmt expressionStmt)) return Optional.empty();
        Expression expression = expressionStmt.getExpression();

        if (expression instanceof AssignExpr assign && assign.getOperator() == AssignExpr.Operator.ASSIGN) {
            return Optional.of(new Transfer(assign.getTarget().toString(), assign.getValue().toString()));
        }
        if (expression instanceof VariableDeclarationExpr declaration && declaration.getVariables().size() == 1) {
            VariableDeclarator variable = declaration.getVariable(0);
            return variable.getInitializer()
                    .map(init -> new Transfer(variable.getNameAsString(), init.toString()));
        }
        return Optional.empty();
    }

    private static boolean isHalving(BinaryExpr binary) {
        return switch (binary.getOperator()) {
            case DIVIDE -> isLiteral(binary.getRight(), "2");
            case SIGNED_RIGHT_SHIFT, UNSIGNED_RIGHT_SHIFT -> isLiteral(binary.getRight(), "1");
            default -> false;
        };
    }

    private static boolean isHalvingAssignment(AssignExpr assign) {
        return switch (assign.getOperator()) {
            case DIVIDE -> isLiteral(assign.getValue(), "2");
            case SIGNED_RIGHT_SHIFT, UNSIGNED_RIGHT_SHIFT -> isLiteral(assign.getValue(), "1");
            default -> false;
        };
    }

    private static boolean isLiteral(Expression expression, String value) {
        return expression instanceof IntegerLiteralExpr literal && value.equals(literal.getValue());
    }

    private static String lower(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    private FeatureRecord toRecord() {
        return FeatureRecord.builder()
                .loopCount(loopCount)
                .conditionalCount(conditionalCount)
                .functionCount(functionCount)
                .maxLoopDepth(maxLoopDepth)
                .recursion(recursion)
                // 파일마다 반드시 있는 최상위 클래스는 제외
                .typeDefined(typeCount > 1)
                .dataStructures(Set.copyOf(dataStructures))
                .hints(Set.copyOf(hints))
                .functionNames(List.copyOf(functionNames))
                .referencedNames(List.copyOf(referencedNames))
                .nodeTokens(List.copyOf(nodeTokens))
                .build();
    }

    private record Transfer(String target, String source) {}
}
