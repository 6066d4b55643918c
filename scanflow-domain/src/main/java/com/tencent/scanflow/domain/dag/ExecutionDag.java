package com.tencent.scanflow.domain.dag;

import com.tencent.scanflow.domain.exception.CycleDetectedException;
import com.tencent.scanflow.domain.exception.MissingArtifactException;
import com.tencent.scanflow.domain.runbook.ArtifactDefinition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * ExecutionDag - 制品依赖图
 * <p>
 * 节点为制品 ID，边 "A 依赖 B" 来自 inputs 声明。构建后不可变，节点保持声明顺序，
 * 拓扑序在多个可选节点间按声明顺序决定，结果稳定。
 * </p>
 */
public final class ExecutionDag {

    private final Map<String, Set<String>> dependencies;
    private final Map<String, Set<String>> dependents;

    private ExecutionDag(Map<String, Set<String>> dependencies) {
        Map<String, Set<String>> deps = new LinkedHashMap<>();
        Map<String, Set<String>> reverse = new LinkedHashMap<>();
        dependencies.keySet().forEach(id -> reverse.put(id, new LinkedHashSet<>()));
        dependencies.forEach((id, upstream) -> {
            deps.put(id, Collections.unmodifiableSet(new LinkedHashSet<>(upstream)));
            upstream.forEach(u -> reverse.get(u).add(id));
        });
        reverse.replaceAll((id, set) -> Collections.unmodifiableSet(set));
        this.dependencies = Collections.unmodifiableMap(deps);
        this.dependents = Collections.unmodifiableMap(reverse);
    }

    /**
     * 由制品定义构建依赖图
     *
     * @throws MissingArtifactException inputs 引用了不存在的制品
     */
    public static ExecutionDag fromArtifacts(Map<String, ArtifactDefinition> artifacts) {
        Map<String, Set<String>> dependencies = new LinkedHashMap<>();
        artifacts.forEach((id, artifact) -> dependencies.put(id, new LinkedHashSet<>(artifact.getInputs())));
        return of(dependencies);
    }

    /**
     * 由依赖关系构建依赖图: 节点 -> 其直接依赖
     *
     * @throws MissingArtifactException 依赖了不存在的节点
     */
    public static ExecutionDag of(Map<String, ? extends Collection<String>> dependencies) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        dependencies.forEach((id, upstream) -> {
            for (String dependency : upstream) {
                if (!dependencies.containsKey(dependency)) {
                    throw new MissingArtifactException(id, dependency);
                }
            }
            copy.put(id, new LinkedHashSet<>(upstream));
        });
        return new ExecutionDag(copy);
    }

    public Set<String> getNodes() {
        return dependencies.keySet();
    }

    public int size() {
        return dependencies.size();
    }

    public boolean contains(String id) {
        return dependencies.containsKey(id);
    }

    /**
     * 直接依赖
     */
    public Set<String> getDependencies(String id) {
        return require(dependencies, id);
    }

    /**
     * 直接下游
     */
    public Set<String> getDependents(String id) {
        return require(dependents, id);
    }

    /**
     * 所有传递下游，按广度优先顺序
     */
    public Set<String> getTransitiveDependents(String id) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(getDependents(id));
        while (!queue.isEmpty()) {
            String next = queue.poll();
            if (visited.add(next)) {
                queue.addAll(dependents.get(next));
            }
        }
        return visited;
    }

    /**
     * 无依赖的根节点
     */
    public List<String> getRoots() {
        List<String> roots = new ArrayList<>();
        dependencies.forEach((id, upstream) -> {
            if (upstream.isEmpty()) {
                roots.add(id);
            }
        });
        return roots;
    }

    /**
     * 就绪集合: 尚未完成且未被排除、且所有依赖都已完成的节点
     *
     * @param completed 已完成的节点
     * @param excluded  不再参与调度的节点 (运行中、失败、跳过、挂起)
     */
    public List<String> getReadySet(Set<String> completed, Set<String> excluded) {
        List<String> ready = new ArrayList<>();
        dependencies.forEach((id, upstream) -> {
            if (!completed.contains(id) && !excluded.contains(id) && completed.containsAll(upstream)) {
                ready.add(id);
            }
        });
        return ready;
    }

    /**
     * 环检测: 三色 DFS，返回第一个回边构成的环 (按发现顺序，首尾为同一节点)
     */
    public Optional<List<String>> findCycle() {
        Map<String, Color> colors = new HashMap<>();
        dependencies.keySet().forEach(id -> colors.put(id, Color.WHITE));
        List<String> path = new ArrayList<>();
        for (String id : dependencies.keySet()) {
            if (colors.get(id) == Color.WHITE) {
                List<String> cycle = visit(id, colors, path);
                if (cycle != null) {
                    return Optional.of(cycle);
                }
            }
        }
        return Optional.empty();
    }

    private List<String> visit(String id, Map<String, Color> colors, List<String> path) {
        colors.put(id, Color.GRAY);
        path.add(id);
        for (String next : dependencies.get(id)) {
            Color color = colors.get(next);
            if (color == Color.GRAY) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                cycle.add(next);
                return cycle;
            }
            if (color == Color.WHITE) {
                List<String> cycle = visit(next, colors, path);
                if (cycle != null) {
                    return cycle;
                }
            }
        }
        path.remove(path.size() - 1);
        colors.put(id, Color.BLACK);
        return null;
    }

    /**
     * 校验无环
     *
     * @throws CycleDetectedException 存在环
     */
    public void validateAcyclic() {
        findCycle().ifPresent(cycle -> {
            throw new CycleDetectedException(cycle);
        });
    }

    /**
     * 拓扑序 (依赖在前)
     *
     * @throws CycleDetectedException 存在环
     */
    public List<String> topologicalOrder() {
        validateAcyclic();
        Map<String, Integer> remaining = new LinkedHashMap<>();
        dependencies.forEach((id, upstream) -> remaining.put(id, upstream.size()));

        List<String> order = new ArrayList<>(dependencies.size());
        Set<String> emitted = new LinkedHashSet<>();
        while (order.size() < dependencies.size()) {
            for (Map.Entry<String, Integer> entry : remaining.entrySet()) {
                String id = entry.getKey();
                if (entry.getValue() == 0 && emitted.add(id)) {
                    order.add(id);
                    dependents.get(id).forEach(d -> remaining.merge(d, -1, Integer::sum));
                    break;
                }
            }
        }
        return order;
    }

    /**
     * 节点深度: 根为 0，其余为依赖深度最大值加 1
     */
    public Map<String, Integer> depths() {
        Map<String, Integer> depths = new LinkedHashMap<>();
        for (String id : topologicalOrder()) {
            int depth = dependencies.get(id).stream().mapToInt(depths::get).map(d -> d + 1).max().orElse(0);
            depths.put(id, depth);
        }
        return depths;
    }

    private static Set<String> require(Map<String, Set<String>> index, String id) {
        Set<String> result = index.get(id);
        if (result == null) {
            throw new IllegalArgumentException("Unknown artifact: " + id);
        }
        return result;
    }

    private enum Color {
        WHITE,
        GRAY,
        BLACK
    }
}
