package org.Aayush.tempus.stn;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Persistent simple temporal network over integer time points.
 *
 * <p>Point {@link #ORIGIN} is time zero; every other point is constrained to happen at or
 * after it. Each interval constraint is stored in distance-graph form: {@code u -> v} with
 * weight {@code upper} and {@code v -> u} with weight {@code -lower}.</p>
 *
 * <p>Instances are immutable. {@link #extend} builds a new network that shares the arc lists
 * of its parent and copies only the per-point head and distance arrays.</p>
 *
 * <p>Consistency is maintained incrementally: the network keeps shortest distances from
 * every point to the origin (negated earliest times) and from the origin to every point
 * (latest times). Inserting an arc relaxes distances from its endpoint outward; the insertion
 * closes a negative cycle exactly when relaxation improves the arc's own head.</p>
 */
public final class TemporalNetwork {
    public static final int ORIGIN = 0;

    private static final double TOLERANCE = 1e-9;

    private final int pointCount;
    private final int arcCount;
    private final Link[] outgoing;
    private final Link[] incoming;
    /** Shortest distance point -> origin; earliest time is its negation. */
    private final double[] toOrigin;
    /** Shortest distance origin -> point; the latest time, possibly infinite. */
    private final double[] fromOrigin;

    private TemporalNetwork(int pointCount, int arcCount, Link[] outgoing, Link[] incoming, double[] toOrigin, double[] fromOrigin) {
        this.pointCount = pointCount;
        this.arcCount = arcCount;
        this.outgoing = outgoing;
        this.incoming = incoming;
        this.toOrigin = toOrigin;
        this.fromOrigin = fromOrigin;
    }

    /**
     * Creates a network holding only the origin.
     */
    public static TemporalNetwork create() {
        return new TemporalNetwork(1, 0, new Link[1], new Link[1], new double[]{0.0d}, new double[]{0.0d});
    }

    /**
     * Adds time points and constraints, leaving this network untouched.
     *
     * <p>New points receive ids {@code pointCount() .. pointCount() + newPoints - 1} and an
     * implicit {@code time >= 0} bound. Constraints may reference old and new points.</p>
     *
     * @param newPoints number of points to append.
     * @param constraints constraints to insert, in order.
     * @return the consistent extension, or the constraint that made the network inconsistent.
     * @throws IllegalArgumentException if a constraint references a point outside the extended network.
     */
    public Extension extend(int newPoints, List<TemporalConstraint> constraints) {
        if (newPoints < 0) {
            throw new IllegalArgumentException("newPoints must be >= 0, got " + newPoints);
        }
        Objects.requireNonNull(constraints, "constraints");
        int size = pointCount + newPoints;
        Relaxation work = new Relaxation(
                Arrays.copyOf(outgoing, size),
                Arrays.copyOf(incoming, size),
                Arrays.copyOf(toOrigin, size),
                Arrays.copyOf(fromOrigin, size)
        );
        int arcs = arcCount;
        for (int point = pointCount; point < size; point++) {
            work.toOrigin[point] = 0.0d;
            work.fromOrigin[point] = Double.POSITIVE_INFINITY;
            work.link(point, ORIGIN, 0.0d);
            arcs++;
        }

        for (TemporalConstraint constraint : constraints) {
            if (constraint.from() >= size || constraint.to() >= size) {
                throw new IllegalArgumentException("constraint " + constraint + " references a point outside [0, " + size + ")");
            }
            if (constraint.lower() > constraint.upper() + TOLERANCE) {
                return Extension.inconsistent(constraint);
            }
            if (constraint.upper() != Double.POSITIVE_INFINITY) {
                if (!work.insert(constraint.from(), constraint.to(), constraint.upper())) {
                    return Extension.inconsistent(constraint);
                }
                arcs++;
            }
            if (constraint.lower() != Double.NEGATIVE_INFINITY) {
                if (!work.insert(constraint.to(), constraint.from(), -constraint.lower())) {
                    return Extension.inconsistent(constraint);
                }
                arcs++;
            }
        }
        return Extension.consistent(new TemporalNetwork(size, arcs, work.outgoing, work.incoming, work.toOrigin, work.fromOrigin));
    }

    public int pointCount() {
        return pointCount;
    }

    /**
     * Number of distance-graph arcs, including the implicit origin bounds.
     */
    public int arcCount() {
        return arcCount;
    }

    /**
     * Earliest feasible time of a point.
     */
    public double earliest(int point) {
        checkPoint(point);
        return 0.0d - toOrigin[point];
    }

    /**
     * Latest feasible time of a point, {@link Double#POSITIVE_INFINITY} when unbounded.
     */
    public double latest(int point) {
        checkPoint(point);
        return fromOrigin[point];
    }

    /**
     * Earliest-time assignment for every point; it satisfies all constraints.
     */
    public double[] schedule() {
        double[] times = new double[pointCount];
        for (int point = 0; point < pointCount; point++) {
            times[point] = 0.0d - toOrigin[point];
        }
        return times;
    }

    /**
     * Largest earliest time over all points.
     */
    public double makespan() {
        double makespan = 0.0d;
        for (int point = 0; point < pointCount; point++) {
            makespan = Math.max(makespan, 0.0d - toOrigin[point]);
        }
        return makespan;
    }

    private void checkPoint(int point) {
        if (point < 0 || point >= pointCount) {
            throw new IndexOutOfBoundsException("time point " + point + " out of bounds [0, " + pointCount + ")");
        }
    }

    /**
     * Immutable adjacency cell shared between network versions.
     */
    private record Link(int node, double weight, Link next) {
    }

    /**
     * Working copy of the per-point arrays while one extension is being built.
     */
    private static final class Relaxation {
        final Link[] outgoing;
        final Link[] incoming;
        final double[] toOrigin;
        final double[] fromOrigin;

        Relaxation(Link[] outgoing, Link[] incoming, double[] toOrigin, double[] fromOrigin) {
            this.outgoing = outgoing;
            this.incoming = incoming;
            this.toOrigin = toOrigin;
            this.fromOrigin = fromOrigin;
        }

        void link(int from, int to, double weight) {
            outgoing[from] = new Link(to, weight, outgoing[from]);
            incoming[to] = new Link(from, weight, incoming[to]);
        }

        /**
         * Inserts arc {@code from -> to} and restores both distance arrays.
         *
         * @return false when the arc closes a negative cycle.
         */
        boolean insert(int from, int to, double weight) {
            if (from == to) {
                return weight >= -TOLERANCE;
            }
            link(from, to, weight);
            return relaxTowardOrigin(from, to, weight) && relaxFromOrigin(from, to, weight);
        }

        private boolean relaxTowardOrigin(int from, int to, double weight) {
            double candidate = weight + toOrigin[to];
            if (candidate >= toOrigin[from] - TOLERANCE) {
                return true;
            }
            if (from == ORIGIN) {
                return false;
            }
            toOrigin[from] = candidate;
            IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
            boolean[] queued = new boolean[toOrigin.length];
            queue.enqueue(from);
            queued[from] = true;
            while (!queue.isEmpty()) {
                int point = queue.dequeueInt();
                queued[point] = false;
                for (Link link = incoming[point]; link != null; link = link.next()) {
                    int predecessor = link.node();
                    double improved = link.weight() + toOrigin[point];
                    if (improved < toOrigin[predecessor] - TOLERANCE) {
                        if (predecessor == to || predecessor == ORIGIN) {
                            return false;
                        }
                        toOrigin[predecessor] = improved;
                        if (!queued[predecessor]) {
                            queue.enqueue(predecessor);
                            queued[predecessor] = true;
                        }
                    }
                }
            }
            return true;
        }

        private boolean relaxFromOrigin(int from, int to, double weight) {
            if (fromOrigin[from] == Double.POSITIVE_INFINITY) {
                return true;
            }
            double candidate = fromOrigin[from] + weight;
            if (candidate >= fromOrigin[to] - TOLERANCE) {
                return true;
            }
            if (to == ORIGIN) {
                return false;
            }
            fromOrigin[to] = candidate;
            IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
            boolean[] queued = new boolean[fromOrigin.length];
            queue.enqueue(to);
            queued[to] = true;
            while (!queue.isEmpty()) {
                int point = queue.dequeueInt();
                queued[point] = false;
                for (Link link = outgoing[point]; link != null; link = link.next()) {
                    int successor = link.node();
                    double improved = fromOrigin[point] + link.weight();
                    if (improved < fromOrigin[successor] - TOLERANCE) {
                        if (successor == from || successor == ORIGIN) {
                            return false;
                        }
                        fromOrigin[successor] = improved;
                        if (!queued[successor]) {
                            queue.enqueue(successor);
                            queued[successor] = true;
                        }
                    }
                }
            }
            return true;
        }
    }
}
