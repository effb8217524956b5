package com.profilebridge.serializer.walk;

import com.profilebridge.serializer.profile.ProfileModel;
import com.profilebridge.serializer.snapshot.Allocation;
import com.profilebridge.serializer.snapshot.AllocationProfileNode;
import com.profilebridge.serializer.snapshot.LineTick;
import com.profilebridge.serializer.snapshot.ProfileNode;
import com.profilebridge.serializer.snapshot.TimeProfileNode;
import com.profilebridge.serializer.sourcemap.SourceLocation;
import com.profilebridge.serializer.sourcemap.SourceResolver;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Walks a native call tree once, interning a location for every node into the
 * profile's tables and handing each node's weight to a {@link SampleAggregator}.
 *
 * Traversal is depth-first pre-order with children in native order. The root is
 * visited and interned, but as the runtime's synthetic {@code (root)} frame it is
 * left out of its descendants' paths.
 *
 * One walker serves one serialization call; it is not thread-safe.
 */
public class ProfileTreeWalker {

    private final ProfileModel.Profile profile;
    private final SourceResolver sourceResolver;

    // generated position -> resolved position (empty = use generated)
    private final Map<SourceLocation, Optional<SourceLocation>> resolved = new HashMap<>();

    public ProfileTreeWalker(ProfileModel.Profile profile, SourceResolver sourceResolver) {
        this.profile = profile;
        this.sourceResolver = sourceResolver != null ? sourceResolver : SourceResolver.identity();
    }

    private record Entry<N>(N node, LocationPath callerPath, boolean root) {}

    /**
     * Walks a CPU call tree.
     *
     * @return the aggregator's samples, in visit order
     */
    public List<ProfileModel.Sample> walkTimeProfile(TimeProfileNode root, WalkMode mode, SampleAggregator aggregator) {
        Deque<Entry<TimeProfileNode>> stack = new ArrayDeque<>();
        stack.push(new Entry<>(root, null, true));

        while (!stack.isEmpty()) {
            Entry<TimeProfileNode> entry = stack.pop();
            TimeProfileNode node = entry.node();

            long locationId = locationFor(node, node.getLineNumber(), node.getColumnNumber());
            LocationPath path = new LocationPath(locationId, entry.callerPath());
            aggregator.attributeHits(path.toList(), node.getHitCount());

            LocationPath childCallers = entry.root() ? null : path;
            if (mode == WalkMode.LINE_LEVEL) {
                // Line ticks act as extra leaf children, emitted before the real children
                for (LineTick tick : node.getLineTicks()) {
                    if (tick.hitCount() <= 0) continue;
                    long lineLocationId = locationFor(node, tick.line(), 0);
                    aggregator.attributeHits(new LocationPath(lineLocationId, childCallers).toList(), tick.hitCount());
                }
            }

            pushChildren(stack, node.getChildren(), childCallers);
        }
        return aggregator.samples();
    }

    /**
     * Walks an allocation tree. Nodes whose script name contains {@code ignorePath}
     * are skipped along with their subtrees.
     *
     * @return the aggregator's samples, in visit order
     */
    public List<ProfileModel.Sample> walkAllocationProfile(
            AllocationProfileNode root, String ignorePath, SampleAggregator aggregator) {
        Deque<Entry<AllocationProfileNode>> stack = new ArrayDeque<>();
        stack.push(new Entry<>(root, null, true));
        boolean filtering = ignorePath != null && !ignorePath.isEmpty();

        while (!stack.isEmpty()) {
            Entry<AllocationProfileNode> entry = stack.pop();
            AllocationProfileNode node = entry.node();
            if (filtering && node.getScriptName().contains(ignorePath)) {
                continue;
            }

            long locationId = locationFor(node, node.getLineNumber(), node.getColumnNumber());
            LocationPath path = new LocationPath(locationId, entry.callerPath());
            if (!node.getAllocations().isEmpty()) {
                List<Long> ids = path.toList();
                for (Allocation allocation : node.getAllocations()) {
                    aggregator.attributeAllocation(ids, allocation.count(), allocation.sizeBytes());
                }
            }

            pushChildren(stack, node.getChildren(), entry.root() ? null : path);
        }
        return aggregator.samples();
    }

    private static <N> void pushChildren(Deque<Entry<N>> stack, List<N> children, LocationPath callerPath) {
        // reversed so the first child is popped first
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(new Entry<>(children.get(i), callerPath, false));
        }
    }

    // -----------------------------------------------------------------------
    // Interning
    // -----------------------------------------------------------------------

    long locationFor(ProfileNode node, int line, int column) {
        SourceLocation generated = new SourceLocation(node.getScriptName(), line, column, node.getName());
        Optional<SourceLocation> original = line > 0 ? resolve(generated) : Optional.empty();
        SourceLocation effective = original.orElse(generated);

        Long mappingId = null;
        if (original.isPresent()) {
            long filename = profile.strings().intern(node.getScriptName());
            mappingId = profile.mappings().intern(new ProfileModel.Mapping(filename, 0, 0));
        }
        long functionId = functionFor(effective.name(), effective.file(), node.getScriptId());
        return profile.locations().intern(
                new ProfileModel.Location(functionId, effective.line(), effective.column(), mappingId));
    }

    private long functionFor(String name, String file, int scriptId) {
        long nameIndex = profile.strings().intern(name);
        long fileIndex = profile.strings().intern(file);
        return profile.functions().intern(new ProfileModel.Function(nameIndex, nameIndex, fileIndex, scriptId));
    }

    private Optional<SourceLocation> resolve(SourceLocation generated) {
        Optional<SourceLocation> cached = resolved.get(generated);
        if (cached != null) {
            return cached;
        }
        Optional<SourceLocation> result;
        try {
            result = sourceResolver.resolve(generated);
            if (result == null) {
                result = Optional.empty();
            }
        } catch (RuntimeException e) {
            System.err.println("[profile-serializer] WARNING: source resolution failed for "
                    + generated.file() + ":" + generated.line() + ", using generated position: " + e.getMessage());
            result = Optional.empty();
        }
        resolved.put(generated, result);
        return result;
    }
}
