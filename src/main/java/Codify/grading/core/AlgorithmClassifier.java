package Codify.grading.core;

import Codify.grading.model.FeatureRecord;
import Codify.grading.model.PatternHint;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

public final class AlgorithmClassifier {
    private AlgorithmClassifier() {}

    static final String SEQUENCE_OPERATIONS = "Stack/Queue Operations";

    // 함수명, 변수명에 포함된 키워드 -> 라벨
    static final Map<String, String> NAME_LABELS = Map.ofEntries(
            Map.entry("binary_search", "Binary Search"),
            Map.entry("binarysearch", "Binary Search"),
            Map.entry("quick_sort", "Quick Sort"),
            Map.entry("quicksort", "Quick Sort"),
            Map.entry("merge_sort", "Merge Sort"),
            Map.entry("mergesort", "Merge Sort"),
            Map.entry("bubble_sort", "Bubble Sort"),
            Map.entry("bubblesort", "Bubble Sort"),
            Map.entry("insertion_sort", "Insertion Sort"),
            Map.entry("insertionsort", "Insertion Sort"),
            Map.entry("selection_sort", "Selection Sort"),
            Map.entry("selectionsort", "Selection Sort"),
            Map.entry("heap_sort", "Heap Sort"),
            Map.entry("heapsort", "Heap Sort"),
            Map.entry("factorial", "Math/Factorial"),
            Map.entry("fibonacci", "Dynamic Programming / Fibonacci"),
            Map.entry("dfs", "Depth-First Search"),
            Map.entry("bfs", "Breadth-First Search"),
            Map.entry("dijkstra", "Dijkstra's Algorithm"),
            Map.entry("linkedlist", "Linked List"),
            Map.entry("linked_list", "Linked List"),
            Map.entry("stack", "Stack"),
            Map.entry("queue", "Queue"),
            Map.entry("tree", "Tree Structure"),
            Map.entry("graph", "Graph Structure"),
            Map.entry("hash_map", "Hash Map"),
            Map.entry("hashmap", "Hash Map")
    );

    static final Set<String> APPEND_LIKE = Set.of("append", "add", "push", "offer", "addlast", "addfirst");
    static final Set<String> POP_LIKE = Set.of("pop", "poll", "removelast", "removefirst", "polllast", "pollfirst");

    public static List<String> classify(FeatureRecord features) {
        SortedSet<String> detected = new TreeSet<>();

        // 1. 패턴 기반
        if (features.isRecursion()) detected.add("Recursion");
        if (features.nestedLoops()) {
            detected.add("Nested Loops");
        } else if (features.getLoopCount() > 0) {
            detected.add("Iterative Logic");
        }
        if (features.has(PatternHint.HALVING)) detected.add("Binary Search");
        if (features.has(PatternHint.MEMO_TABLE)) detected.add("Dynamic Programming");
        if (features.has(PatternHint.MATRIX)) detected.add("Matrix Operations");
        if (features.has(PatternHint.SWAP)) detected.add("Swap Pattern");

        // 2. 이름 기반
        List<String> names = new ArrayList<>(features.getFunctionNames());
        names.addAll(features.getReferencedNames());
        String allNames = String.join(" ", names);
        NAME_LABELS.forEach((keyword, label) -> {
            if (allNames.contains(keyword)) detected.add(label);
        });

        // 3. push/pop 계열 연산이 같이 보이면 스택/큐 연산으로 본다
        Set<String> nameSet = Set.copyOf(names);
        boolean appends = APPEND_LIKE.stream().anyMatch(nameSet::contains);
        boolean pops = POP_LIKE.stream().anyMatch(nameSet::contains);
        if (appends && pops && !detected.contains("Stack") && !detected.contains("Queue")) {
            detected.add(SEQUENCE_OPERATIONS);
        }

        return List.copyOf(detected);
    }
}
