package io.github.eutro.py2ir.passes.convert;

import io.github.eutro.py2ir.code.CodeObject;
import io.github.eutro.py2ir.code.ConstCollection;
import io.github.eutro.py2ir.code.Instruction;
import io.github.eutro.py2ir.ext.CommonExts;
import io.github.eutro.py2ir.ops.MakeFunctionInfo;
import io.github.eutro.py2ir.ops.Op;
import io.github.eutro.py2ir.ops.PyOps;
import io.github.eutro.py2ir.scope.ScopeTable;
import io.github.eutro.py2ir.scope.ScopedName;
import io.github.eutro.py2ir.ssa.*;
import io.github.eutro.py2ir.util.GraphWalker;

import java.util.*;

import static io.github.eutro.py2ir.passes.convert.StackValues.PendingCollection;

/**
 * The state of one attempt at simulating a procedure's operand stack.
 * <p>
 * Blocks are simulated in reverse post-order, so every forward predecessor of a block has been
 * simulated before it. The entry stack of a block is merged from its forward edges: a slot on which
 * they all agree keeps its value, any other slot becomes a block parameter. Back-edges must then
 * agree with the entry stack of their target; if one does not, the slot is recorded as forced and
 * the attempt is reported as needing a restart.
 */
final class ConvertState {
    private static final class Edge {
        final Instruction source;
        final Jump jump;
        final List<Object> stack;

        Edge(Instruction source, Jump jump, List<Object> stack) {
            this.source = source;
            this.jump = jump;
            this.stack = stack;
        }
    }

    private final ProcedureTranslator pt;
    private final BlockPartition partition;
    private final Set<Long> forced;
    private final Set<Integer> builtOnExit;
    private final Function func;
    private final IRBuilder ib;
    private final BasicBlock[] blocks;
    private final List<List<Edge>> incoming = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();
    private final List<List<Object>> entryStacks = new ArrayList<>();
    private final List<List<Integer>> paramSlots = new ArrayList<>();
    private final List<ProcedureTranslator.Hoisted> hoisted = new ArrayList<>();
    private final Map<PendingCollection, Var> materialized = new IdentityHashMap<>();
    private boolean restart;

    private BlockPartition.Range range;
    private Instruction current;
    private List<Object> stack;
    private boolean terminated;

    ConvertState(ProcedureTranslator pt, BlockPartition partition, Set<Long> forced, Set<Integer> builtOnExit) {
        this.pt = pt;
        this.partition = partition;
        this.forced = forced;
        this.builtOnExit = builtOnExit;
        func = pt.newFunction();
        List<BlockPartition.Range> ranges = partition.getRanges();
        blocks = new BasicBlock[ranges.size()];
        for (BlockPartition.Range r : ranges) {
            blocks[r.id] = func.newBb();
            blocks[r.id].attachExt(CommonExts.SOURCE_OFFSET, r.startOffset());
            incoming.add(new ArrayList<>());
            entryStacks.add(null);
            paramSlots.add(new ArrayList<>());
        }
        ib = new IRBuilder(func, blocks[0]);
    }

    /**
     * Simulate every block.
     *
     * @return Whether the simulation succeeded without needing a restart.
     */
    boolean simulate() {
        List<BlockPartition.Range> ranges = partition.getRanges();
        List<BlockPartition.Range> order = new GraphWalker<BlockPartition.Range>(ranges.get(0), r -> {
            // descending, so that the reverse post-order visits blocks in offset order where it can
            List<BlockPartition.Range> succs = new ArrayList<>();
            for (int i = r.successors.size() - 1; i >= 0; i--) {
                succs.add(ranges.get(r.successors.get(i)));
            }
            return succs;
        }).reversePostOrder();

        for (BlockPartition.Range r : order) {
            range = r;
            current = r.isPreHeader() ? partition.at(r.nextOffset).instructions.get(0) : r.instructions.get(0);
            List<Object> entry = entryStack(r);
            entryStacks.set(r.id, entry);
            stack = new ArrayList<>(entry);
            terminated = false;
            materialized.clear();
            ib.moveTo(blocks[r.id]);
            for (Instruction insn : r.instructions) {
                current = insn;
                Converters.Converter converter = Converters.CONVERTERS.get(insn.opcode);
                if (converter == null) {
                    throw error("no recognized lowering for " + insn.opcode);
                }
                try {
                    converter.convert(this, insn);
                } catch (IllegalArgumentException e) {
                    // malformed operands, like a cell index out of range
                    throw error(e.getMessage());
                }
            }
            if (!terminated) {
                terminate(Control.jmp(edge(r.nextOffset, stack)));
            }
        }
        return !restart;
    }

    ProcedureTranslator.Result finish() {
        for (Edge edge : edges) {
            List<Integer> slots = paramSlots.get(edge.jump.target.id);
            List<Value> args = new ArrayList<>(slots.size());
            for (int slot : slots) {
                Object arg = edge.stack.get(slot);
                if (!(arg instanceof Value)) {
                    throw new TranslationException(edge.source, "cannot pass " + arg + " to a block parameter");
                }
                args.add((Value) arg);
            }
            edge.jump.setArgs(args);
        }
        return new ProcedureTranslator.Result(func, hoisted);
    }

    private List<Object> entryStack(BlockPartition.Range r) {
        List<Edge> in = incoming.get(r.id);
        if (r.id == 0) {
            return new ArrayList<>();
        }
        int depth = in.get(0).stack.size();
        for (Edge edge : in) {
            if (edge.stack.size() != depth) {
                throw error(String.format(
                        "stack depth mismatch at merge into b%d: %d vs %d",
                        r.id,
                        depth,
                        edge.stack.size()));
            }
        }
        List<Object> entry = new ArrayList<>(depth);
        for (int slot = 0; slot < depth; slot++) {
            Object first = in.get(0).stack.get(slot);
            boolean agree = true;
            for (Edge edge : in) {
                agree &= sameValue(first, edge.stack.get(slot));
            }
            if (agree && !forced.contains(slotKey(r.id, slot))) {
                entry.add(first);
            } else {
                for (Edge edge : in) {
                    Object other = edge.stack.get(slot);
                    if (!isMergeable(other)) {
                        throw error("cannot merge " + other + " across control flow");
                    }
                    if (other instanceof PendingCollection) {
                        buildOnExit((PendingCollection) other);
                    }
                }
                Var param = func.newVar();
                blocks[r.id].addParam(param);
                paramSlots.get(r.id).add(slot);
                entry.add(param);
            }
        }
        return entry;
    }

    private void checkBackEdge(Edge edge, int target) {
        List<Object> entry = entryStacks.get(target);
        if (entry.size() != edge.stack.size()) {
            throw error(String.format(
                    "stack depth mismatch on back-edge to b%d: %d vs %d",
                    target,
                    entry.size(),
                    edge.stack.size()));
        }
        List<Integer> params = paramSlots.get(target);
        for (int slot = 0; slot < entry.size(); slot++) {
            if (params.contains(slot)) continue;
            Object expected = entry.get(slot);
            Object actual = edge.stack.get(slot);
            if (!sameValue(expected, actual)) {
                if (!isMergeable(expected) || !isMergeable(actual)) {
                    throw error("cannot merge " + expected + " with " + actual);
                }
                boolean pending = false;
                if (expected instanceof PendingCollection) {
                    buildOnExit((PendingCollection) expected);
                    pending = true;
                }
                if (actual instanceof PendingCollection) {
                    buildOnExit((PendingCollection) actual);
                    pending = true;
                }
                if (!pending) {
                    forced.add(slotKey(target, slot));
                }
                restart = true;
            }
        }
    }

    static long slotKey(int block, int slot) {
        return ((long) block << 32) | slot;
    }

    /**
     * Whether a stack entry can be passed to a block parameter, possibly after being built.
     */
    private static boolean isMergeable(Object o) {
        return o instanceof Value || o instanceof PendingCollection;
    }

    /**
     * Mark a pending collection to be built on every edge that carries it, and restart.
     * Called when it reaches a block parameter, whose value differs between paths.
     */
    private void buildOnExit(PendingCollection pending) {
        builtOnExit.add(pending.origin);
        restart = true;
    }

    private static boolean sameValue(Object a, Object b) {
        return a == b || a instanceof Const && a.equals(b);
    }

    // API for converters

    TranslationException error(String reason) {
        return new TranslationException(current, reason);
    }

    ScopeTable scopes() {
        return pt.scopes;
    }

    void push(Object value) {
        stack.add(value);
    }

    Object pop() {
        if (stack.isEmpty()) {
            throw error("stack underflow");
        }
        return stack.remove(stack.size() - 1);
    }

    Value popValue() {
        return toValue(pop());
    }

    /**
     * Pop values pushed in order.
     *
     * @param n The number of values.
     * @return The values, the first pushed first.
     */
    List<Value> popValues(int n) {
        if (stack.size() < n) {
            throw error("stack underflow");
        }
        List<Value> values = new ArrayList<>(n);
        List<Object> top = stack.subList(stack.size() - n, stack.size());
        for (Object o : top) {
            values.add(toValue(o));
        }
        top.clear();
        return values;
    }

    /**
     * Peek at the stack.
     *
     * @param depth The depth, 1 for the top of the stack.
     * @return The value at that depth.
     */
    Object peek(int depth) {
        if (depth < 1 || stack.size() < depth) {
            throw error("stack underflow");
        }
        return stack.get(stack.size() - depth);
    }

    void set(int depth, Object value) {
        peek(depth);
        stack.set(stack.size() - depth, value);
    }

    List<Object> stackCopy() {
        return new ArrayList<>(stack);
    }

    /**
     * Convert a stack entry to a value, folding a pending collection into a constant.
     *
     * @param o The stack entry.
     * @return The value.
     */
    Value toValue(Object o) {
        if (o instanceof Value) return (Value) o;
        if (o instanceof PendingCollection) {
            Var built = materialized.get(o);
            return built != null ? built : ((PendingCollection) o).toConst();
        }
        throw error("expected a value, found " + o);
    }

    /**
     * Get the entry at a stack depth as a value, building it explicitly if it is a pending
     * collection, so that it can be mutated or observed more than once.
     *
     * @param depth The depth, 1 for the top of the stack.
     * @return The value.
     */
    Value materializeAt(int depth) {
        Object o = peek(depth);
        if (o instanceof PendingCollection) {
            return build((PendingCollection) o);
        }
        return toValue(o);
    }

    Var build(PendingCollection pending) {
        Var built = materialized.get(pending);
        if (built == null) {
            Op op;
            switch (pending.kind) {
                case LIST:
                    op = PyOps.BUILD_LIST;
                    break;
                case SET:
                    op = PyOps.BUILD_SET;
                    break;
                case DICT:
                    op = PyOps.BUILD_MAP;
                    break;
                default:
                    throw new IllegalStateException("pending " + pending.kind);
            }
            built = emit(op, pending.itemValues());
            materialized.put(pending, built);
        }
        for (int i = 0; i < stack.size(); i++) {
            if (stack.get(i) == pending) stack.set(i, built);
        }
        return built;
    }

    /**
     * Create a pending collection at the current instruction.
     *
     * @param kind  The kind of collection.
     * @param items The constant items.
     * @return The pending collection, which the caller pushes.
     */
    PendingCollection pending(ConstCollection.Kind kind, List<?> items) {
        return new PendingCollection(current.offset, kind, items);
    }

    Var emit(Op op, Value... args) {
        return ib.assign(op, Arrays.asList(args));
    }

    Var emit(Op op, List<? extends Value> args) {
        return ib.assign(op, args);
    }

    void store(Op op, Value... args) {
        ib.perform(op, Arrays.asList(args));
    }

    /**
     * Create an edge from the current block, carrying a stack.
     * Pending collections stay pending, so a target reached only with the same collection
     * can still fold it into a constant, unless they have been found to reach a block parameter.
     *
     * @param offset The target offset.
     * @param edgeStack The stack at the target.
     * @return The jump, whose arguments are filled when the procedure is finished.
     */
    Jump edge(int offset, List<Object> edgeStack) {
        if (offset < 0) {
            throw error("control falls off the end of the code");
        }
        BlockPartition.Range target = partition.at(offset);
        List<Object> snapshot = new ArrayList<>(edgeStack.size());
        for (Object o : edgeStack) {
            if (o instanceof PendingCollection && builtOnExit.contains(((PendingCollection) o).origin)) {
                snapshot.add(build((PendingCollection) o));
            } else {
                snapshot.add(o);
            }
        }
        Jump jump = new Jump(blocks[target.id]);
        Edge edge = new Edge(current, jump, snapshot);
        edges.add(edge);
        if (entryStacks.get(target.id) != null) {
            checkBackEdge(edge, target.id);
        } else {
            incoming.get(target.id).add(edge);
        }
        return jump;
    }

    /**
     * Get the offset of the instruction after the current block.
     *
     * @return The offset.
     */
    int fallthroughOffset() {
        if (range.nextOffset < 0) {
            throw error("control falls off the end of the code");
        }
        return range.nextOffset;
    }

    void terminate(Control control) {
        ib.terminate(control);
        terminated = true;
    }

    /**
     * Hoist a nested code object into its own procedure.
     *
     * @param code The nested code object.
     * @return The immediate of the instruction creating the closure.
     */
    MakeFunctionInfo hoist(CodeObject code) {
        LexicalPath childPath = pt.path.child(code.name);
        List<ScopedName> captured = new ArrayList<>();
        for (String free : code.freevars) {
            captured.add(pt.scopes.cellNamed(free)
                    .orElseThrow(() -> error(String.format(
                            "free variable %s of %s is not a cell of %s",
                            free,
                            childPath,
                            pt.path))));
        }
        hoisted.add(new ProcedureTranslator.Hoisted(code, childPath));
        return new MakeFunctionInfo(code.name, childPath.toString(), captured);
    }

    static Const tupleOf(List<Value> values) {
        List<Object> items = new ArrayList<>(values.size());
        for (Value value : values) {
            items.add(((Const) value).value);
        }
        return Const.of(new ConstCollection(ConstCollection.Kind.TUPLE, items));
    }
}
