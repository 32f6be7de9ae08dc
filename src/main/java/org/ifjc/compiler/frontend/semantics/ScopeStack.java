package org.ifjc.compiler.frontend.semantics;

import org.ifjc.compiler.diagnostics.SemanticException;
import org.ifjc.compiler.frontend.parser.ast.AstNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * LIFO stack of {@link ScopeFrame}s; the top frame is the innermost active scope.
 * <p>
 * A declaration stack creates frames: {@link #enter(AstNode)} assigns the next scope label and
 * records the new frame in the shared scope map under its owning node. A resolution stack never
 * creates frames: {@link #reenter(AstNode)} pushes the frame recorded for the node. Frames and
 * labels are pushed and popped together, so the label stack cannot drift from the frame stack.
 */
public class ScopeStack {

    private static final Logger log = LoggerFactory.getLogger(ScopeStack.class);

    private final Deque<ScopeFrame> frames = new ArrayDeque<>();
    private final Map<AstNode, ScopeFrame> scopeMap;
    private final ScopeIdStack ids;
    private final int frameCapacity;

    private ScopeStack(Map<AstNode, ScopeFrame> scopeMap, ScopeIdStack ids, int frameCapacity) {
        this.scopeMap = scopeMap;
        this.ids = ids;
        this.frameCapacity = frameCapacity;
    }

    /**
     * Creates a stack that opens new frames and records them in {@code scopeMap}.
     *
     * @param maxDepth      Maximum nesting depth.
     * @param frameCapacity Slot count of each frame's symbol table.
     * @param scopeMap      Identity-keyed map receiving one frame per owning node.
     * @return A new, empty declaration stack.
     */
    public static ScopeStack forDeclaration(int maxDepth, int frameCapacity, Map<AstNode, ScopeFrame> scopeMap) {
        return new ScopeStack(scopeMap, new ScopeIdStack(maxDepth), frameCapacity);
    }

    /**
     * Creates a stack that re-enters the frames recorded by a declaration stack.
     *
     * @param scopeMap The map filled by the declaration pass.
     * @return A new, empty resolution stack.
     */
    public static ScopeStack forResolution(Map<AstNode, ScopeFrame> scopeMap) {
        return new ScopeStack(scopeMap, null, 0);
    }

    // === Frame management ===

    /**
     * Opens a new empty frame for {@code owner}.
     * @param owner The block, function or accessor opening the scope.
     * @return The new frame.
     */
    public ScopeFrame enter(AstNode owner) {
        if (ids == null) {
            throw new IllegalStateException("A resolution stack only re-enters recorded frames.");
        }
        String path = frames.isEmpty() ? ids.enterRoot() : ids.enterChild();
        ScopeFrame frame = new ScopeFrame(path, owner, frameCapacity);
        frames.push(frame);
        scopeMap.put(owner, frame);
        log.debug("scope PUSH {} (depth={})", path, frames.size());
        return frame;
    }

    /**
     * Pushes the frame the declaration pass recorded for {@code owner}.
     * <p>
     * Locals in the frame stop resolving until their declaration is walked again, see
     * {@link #lookupDefined(String)}. Parameters stay resolvable.
     *
     * @param owner The node that opened the frame during the declaration pass.
     * @return The recorded frame.
     * @throws SemanticException of kind INTERNAL if no frame was recorded for the node.
     */
    public ScopeFrame reenter(AstNode owner) {
        ScopeFrame frame = scopeMap.get(owner);
        if (frame == null) {
            throw SemanticException.internal("No scope recorded for " + owner.getClass().getSimpleName() + ".");
        }
        frame.symbols().forEach((key, symbol) -> {
            if (symbol.kind() == SymbolKind.VARIABLE) {
                symbol.setDefined(false);
            }
        });
        frames.push(frame);
        log.debug("scope RE-ENTER {} (depth={})", frame.path(), frames.size());
        return frame;
    }

    /**
     * Pops the top frame.
     * @throws SemanticException of kind INTERNAL on underflow.
     */
    public void leave() {
        if (frames.isEmpty()) {
            throw SemanticException.internal("Scope stack underflow.");
        }
        ScopeFrame frame = frames.pop();
        if (ids != null) {
            ids.leave();
        }
        log.debug("scope POP {} (depth={})", frame.path(), frames.size());
    }

    /**
     * Pops every frame. Recorded frames stay in the scope map.
     */
    public void dispose() {
        while (!frames.isEmpty()) {
            leave();
        }
    }

    // === Declarations ===

    /**
     * Declares a variable in the current frame.
     * @see #declareLocal(String, SymbolKind, boolean)
     */
    public boolean declareLocal(String name, boolean defined) {
        return declareLocal(name, SymbolKind.VARIABLE, defined);
    }

    /**
     * Declares a local in the current frame. Shadowing a name of an outer frame is always allowed.
     *
     * @param name    The identifier.
     * @param kind    Variable or parameter.
     * @param defined Initial defined flag.
     * @return false if the current frame already holds {@code name}.
     * @throws SemanticException of kind INTERNAL if no frame is open.
     */
    public boolean declareLocal(String name, SymbolKind kind, boolean defined) {
        ScopeFrame top = requireCurrent();
        if (top.symbols().contains(name)) {
            return false;
        }
        top.symbols().insert(name, kind, defined).withScopePath(top.path());
        return true;
    }

    // === Lookup ===

    /**
     * Searches only the current frame.
     */
    public Optional<Symbol> lookupInCurrent(String name) {
        ScopeFrame top = frames.peek();
        return top == null ? Optional.empty() : top.symbols().get(name);
    }

    /**
     * Searches from the innermost frame outwards and returns the first match.
     */
    public Optional<Symbol> lookup(String name) {
        for (ScopeFrame frame : frames) {
            Optional<Symbol> symbol = frame.symbols().get(name);
            if (symbol.isPresent()) {
                return symbol;
            }
        }
        return Optional.empty();
    }

    /**
     * Like {@link #lookup(String)}, but skips symbols whose declaration has not been reached yet.
     */
    public Optional<Symbol> lookupDefined(String name) {
        for (ScopeFrame frame : frames) {
            Optional<Symbol> symbol = frame.symbols().get(name);
            if (symbol.isPresent() && symbol.get().defined()) {
                return symbol;
            }
        }
        return Optional.empty();
    }

    // === State ===

    public Optional<ScopeFrame> current() {
        return Optional.ofNullable(frames.peek());
    }

    /**
     * @return The label of the innermost frame, or {@code "global"} if none is open.
     */
    public String currentPath() {
        ScopeFrame top = frames.peek();
        return top == null ? ScopeIdStack.GLOBAL : top.path();
    }

    public int depth() {
        return frames.size();
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    /**
     * @return Frames from innermost to outermost.
     */
    public Iterator<ScopeFrame> frames() {
        return frames.iterator();
    }

    /**
     * @return The innermost frame.
     * @throws SemanticException of kind INTERNAL if no frame is open.
     */
    public ScopeFrame requireCurrent() {
        ScopeFrame top = frames.peek();
        if (top == null) {
            throw SemanticException.internal("No scope is open.");
        }
        return top;
    }
}
