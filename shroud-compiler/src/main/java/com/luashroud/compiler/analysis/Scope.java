package com.luashroud.compiler.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 作用域
 *
 * <p>每个作用域维护名字到符号标识的映射，以及一份引用账目：对于本作用域子树中引用的、
 * 声明在祖先作用域里的每个变量，记录 (声明作用域, 标识) 的引用次数。变量声明作用域自身只记录总引用次数。</p>
 *
 * <p>根作用域是全局作用域，全局变量按名字扁平地驻留在这里。</p>
 */
public final class Scope {

    private Scope parent;
    private final boolean global;
    private final List<Scope> children = new ArrayList<Scope>();

    // 声明顺序；同一作用域内重复声明的名字会指向最新的标识
    private final Map<SymbolId, String> variables = new LinkedHashMap<SymbolId, String>();
    private final Map<String, SymbolId> names = new LinkedHashMap<String, SymbolId>();

    private final Map<SymbolId, Integer> referenceCounts = new IdentityHashMap<SymbolId, Integer>();
    private final Map<Scope, Map<SymbolId, Integer>> higherReferences = new LinkedHashMap<Scope, Map<SymbolId, Integer>>();

    // 仅全局作用域使用：序号计数器，以及树中出现过的全部变量名
    private int serialCounter;
    private final Set<String> usedNames = new HashSet<String>();

    private boolean attached;
    private boolean merged;

    private Scope(Scope parent, boolean global) {
        this.parent = parent;
        this.global = global;
        if (parent != null) {
            parent.children.add(this);
        }
    }

    /** 创建子作用域 */
    public Scope(Scope parent) {
        this(requireParent(parent), false);
    }

    /** 创建一棵新树的全局作用域 */
    public static Scope newGlobal() {
        return new Scope(null, true);
    }

    private static Scope requireParent(Scope parent) {
        if (parent == null) {
            throw new IllegalArgumentException("local scope requires a parent, use Scope.newGlobal()");
        }
        return parent;
    }

    public Scope getParent() { return parent; }
    public boolean isGlobal() { return global; }
    public List<Scope> getChildren() { return Collections.unmodifiableList(children); }
    /** 是否已通过 {@link #mergeIntoParent()} 并入父作用域，之后不能再使用 */
    public boolean isMerged() { return merged; }

    /** 到根作用域的距离，全局作用域为 0 */
    public int getLevel() {
        int level = 0;
        for (Scope s = parent; s != null; s = s.parent) level++;
        return level;
    }

    /** 所在树的全局作用域 */
    public Scope getGlobalScope() {
        Scope s = this;
        while (s.parent != null) s = s.parent;
        return s;
    }

    /** other 是否为本作用域或其后代 */
    public boolean isAncestorOf(Scope other) {
        for (Scope s = other; s != null; s = s.parent) {
            if (s == this) return true;
        }
        return false;
    }

    // ============ 声明 ============

    /** 声明新变量，名字为 {@code _<序号>}，且不与树中任何已有名字相同 */
    public SymbolId addVariable() {
        return addVariable(null);
    }

    /**
     * 声明新变量。总是分配新的标识；与外层同名（或与本作用域先前的声明同名）都是合法的遮蔽。
     */
    public SymbolId addVariable(String nameHint) {
        Scope root = getGlobalScope();
        SymbolId id = new SymbolId(root.nextSerial());
        String name = nameHint;
        if (name == null) {
            name = "_" + id.getSerial();
            if (root.usedNames.contains(name)) {
                name = root.uniqueName();
            }
        }
        root.usedNames.add(name);
        variables.put(id, name);
        names.put(name, id);
        return id;
    }

    /** 生成一个树中从未声明或驻留过的名字，形如 {@code _<序号>} */
    public String uniqueName() {
        Scope root = getGlobalScope();
        String name;
        do {
            name = "_" + root.nextSerial();
        } while (root.usedNames.contains(name));
        return name;
    }

    private int nextSerial() {
        return ++serialCounter;
    }

    public boolean isDeclared(SymbolId id) {
        return variables.containsKey(id);
    }

    /** 按声明顺序返回本作用域的变量 */
    public List<SymbolId> getVariables() {
        return Collections.unmodifiableList(new ArrayList<SymbolId>(variables.keySet()));
    }

    /** 反查变量名：从本作用域向上查找声明 */
    public String getVariableName(SymbolId id) {
        for (Scope s = this; s != null; s = s.parent) {
            String name = s.variables.get(id);
            if (name != null) return name;
        }
        return null;
    }

    public void renameVariable(SymbolId id, String name) {
        String old = variables.get(id);
        if (old == null) {
            throw new ScopeConsistencyException("cannot rename " + id + ": not declared in " + this);
        }
        if (global) {
            throw new ScopeConsistencyException("cannot rename global " + old);
        }
        variables.put(id, name);
        unlinkName(old, id);
        names.put(name, id);
        getGlobalScope().usedNames.add(name);
    }

    /** 移除声明；调用方负责先移走所有引用 */
    public void removeVariable(SymbolId id) {
        String old = variables.remove(id);
        if (old == null) {
            throw new ScopeConsistencyException("cannot remove " + id + ": not declared in " + this);
        }
        unlinkName(old, id);
        referenceCounts.remove(id);
    }

    // 名字原先指向 id 时，退回到同名的最近一次声明
    private void unlinkName(String name, SymbolId id) {
        if (names.get(name) != id) return;
        names.remove(name);
        for (Map.Entry<SymbolId, String> e : variables.entrySet()) {
            if (e.getKey() != id && e.getValue().equals(name)) {
                names.put(name, e.getKey());
            }
        }
    }

    // ============ 解析 ============

    /** 仅在本作用域中查找 */
    public SymbolId resolveLocal(String name) {
        return names.get(name);
    }

    /** 由内向外在局部作用域链上查找，不查全局；找不到返回 null */
    public Binding resolve(String name) {
        for (Scope s = this; s != null && !s.global; s = s.parent) {
            SymbolId id = s.names.get(name);
            if (id != null) return new Binding(s, id);
        }
        return null;
    }

    /** 在树的全局命名空间中驻留名字，与请求的作用域无关 */
    public Binding resolveGlobal(String name) {
        Scope root = getGlobalScope();
        SymbolId id = root.names.get(name);
        if (id == null) {
            id = root.addVariable(name);
        }
        return new Binding(root, id);
    }

    /**
     * 解析名字：局部变量优先，其次是已驻留的全局变量。
     *
     * @throws ScopeConsistencyException 名字既不是局部变量也不是已知全局变量
     */
    public Binding lookup(String name) {
        Binding local = resolve(name);
        if (local != null) return local;
        Scope root = getGlobalScope();
        SymbolId id = root.names.get(name);
        if (id == null) {
            throw new ScopeConsistencyException("unresolved name '" + name + "' in " + this);
        }
        return new Binding(root, id);
    }

    // ============ 引用账目 ============

    public void addReferenceToHigherScope(Scope owner, SymbolId id) {
        addReferenceToHigherScope(owner, id, 1);
    }

    /**
     * 记录本作用域子树对 owner 中变量 id 的 count 次引用：从本作用域到 owner（不含）的每一层都登记，
     * owner 自身的引用计数同时增加。owner 为本作用域时只增加计数。
     */
    public void addReferenceToHigherScope(Scope owner, SymbolId id, int count) {
        checkReference(owner, id, count);
        for (Scope s = this; s != owner; s = s.parent) {
            Map<SymbolId, Integer> refs = s.higherReferences.get(owner);
            if (refs == null) {
                refs = new LinkedHashMap<SymbolId, Integer>();
                s.higherReferences.put(owner, refs);
            }
            Integer old = refs.get(id);
            refs.put(id, old == null ? count : old + count);
        }
        Integer old = owner.referenceCounts.get(id);
        owner.referenceCounts.put(id, old == null ? count : old + count);
    }

    public void removeReferenceToHigherScope(Scope owner, SymbolId id) {
        removeReferenceToHigherScope(owner, id, 1);
    }

    /** addReferenceToHigherScope 的逆操作；任一层计数不足时不做任何修改并抛出异常 */
    public void removeReferenceToHigherScope(Scope owner, SymbolId id, int count) {
        checkReference(owner, id, count);
        for (Scope s = this; s != owner; s = s.parent) {
            if (s.getHigherReferenceCount(owner, id) < count) {
                throw new ScopeConsistencyException("reference ledger underflow for " + id + " in " + s);
            }
        }
        if (owner.getReferenceCount(id) < count) {
            throw new ScopeConsistencyException("reference count underflow for " + id + " in " + owner);
        }
        for (Scope s = this; s != owner; s = s.parent) {
            Map<SymbolId, Integer> refs = s.higherReferences.get(owner);
            int left = refs.get(id) - count;
            if (left == 0) {
                refs.remove(id);
                if (refs.isEmpty()) s.higherReferences.remove(owner);
            } else {
                refs.put(id, left);
            }
        }
        int left = owner.referenceCounts.get(id) - count;
        if (left == 0) {
            owner.referenceCounts.remove(id);
        } else {
            owner.referenceCounts.put(id, left);
        }
    }

    private void checkReference(Scope owner, SymbolId id, int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("reference count must be positive: " + count);
        }
        if (owner == null || !owner.isAncestorOf(this)) {
            throw new ScopeConsistencyException(owner + " is not an ancestor of " + this);
        }
        if (!owner.isDeclared(id)) {
            throw new ScopeConsistencyException(id + " is not declared in " + owner);
        }
    }

    /** 变量在其声明作用域中的总引用次数 */
    public int getReferenceCount(SymbolId id) {
        Integer count = referenceCounts.get(id);
        return count == null ? 0 : count;
    }

    /** 本作用域子树对 owner 中变量 id 的引用次数 */
    public int getHigherReferenceCount(Scope owner, SymbolId id) {
        Map<SymbolId, Integer> refs = higherReferences.get(owner);
        if (refs == null) return 0;
        Integer count = refs.get(id);
        return count == null ? 0 : count;
    }

    /** 账目的只读视图：声明作用域 → (标识 → 次数) */
    public Map<Scope, Map<SymbolId, Integer>> getHigherReferences() {
        Map<Scope, Map<SymbolId, Integer>> view = new LinkedHashMap<Scope, Map<SymbolId, Integer>>();
        for (Map.Entry<Scope, Map<SymbolId, Integer>> e : higherReferences.entrySet()) {
            view.put(e.getKey(), Collections.unmodifiableMap(e.getValue()));
        }
        return Collections.unmodifiableMap(view);
    }

    // ============ 挂接 ============

    /**
     * 把独立解析得到的作用域挂到另一棵树的 newParent 下。只能调用一次。
     *
     * <p>子树内的局部标识保持不变；指向原全局作用域的账目按名字改挂到宿主全局作用域，
     * 并沿 newParent 向上补登记。子树引用了未随之挂接的祖先变量时，在修改任何状态前拒绝。</p>
     *
     * @return 原全局标识到宿主全局标识的映射，供调用方改写引用节点
     */
    public Map<SymbolId, SymbolId> attachTo(Scope newParent) {
        if (newParent == null) {
            throw new IllegalArgumentException("newParent");
        }
        if (attached) {
            throw new ScopeConsistencyException(this + " has already been attached");
        }
        if (global) {
            throw new ScopeConsistencyException("a global scope cannot be attached");
        }
        Scope oldRoot = getGlobalScope();
        Scope newRoot = newParent.getGlobalScope();
        if (oldRoot == newRoot) {
            throw new ScopeConsistencyException(this + " already belongs to the tree of " + newParent);
        }

        List<Scope> subtree = new ArrayList<Scope>();
        collectSubtree(subtree);
        Set<Scope> members = Collections.newSetFromMap(new IdentityHashMap<Scope, Boolean>());
        members.addAll(subtree);
        for (Scope s : subtree) {
            for (Scope owner : s.higherReferences.keySet()) {
                if (owner != oldRoot && !members.contains(owner)) {
                    throw new ScopeConsistencyException(s + " references variables of " + owner
                            + " which is not part of the attached subtree");
                }
            }
        }

        Map<SymbolId, SymbolId> globals = new LinkedHashMap<SymbolId, SymbolId>();
        for (Scope s : subtree) {
            Map<SymbolId, Integer> refs = s.higherReferences.remove(oldRoot);
            if (refs == null) continue;
            Map<SymbolId, Integer> rekeyed = s.higherReferences.get(newRoot);
            if (rekeyed == null) {
                rekeyed = new LinkedHashMap<SymbolId, Integer>();
                s.higherReferences.put(newRoot, rekeyed);
            }
            for (Map.Entry<SymbolId, Integer> e : refs.entrySet()) {
                SymbolId hostId = globals.get(e.getKey());
                if (hostId == null) {
                    hostId = newRoot.resolveGlobal(oldRoot.variables.get(e.getKey())).getId();
                    globals.put(e.getKey(), hostId);
                }
                Integer old = rekeyed.get(hostId);
                rekeyed.put(hostId, old == null ? e.getValue() : old + e.getValue());
            }
        }

        // 子树的总引用量沿宿主链登记，原全局作用域不再持有这些引用
        Map<SymbolId, Integer> totals = higherReferences.get(newRoot);
        if (totals != null) {
            for (Map.Entry<SymbolId, Integer> e : totals.entrySet()) {
                newParent.addReferenceToHigherScope(newRoot, e.getKey(), e.getValue());
            }
        }
        for (SymbolId oldId : globals.keySet()) {
            oldRoot.referenceCounts.remove(oldId);
        }

        for (Scope s : subtree) {
            newRoot.usedNames.addAll(s.variables.values());
        }

        parent.children.remove(this);
        parent = newParent;
        newParent.children.add(this);
        attached = true;
        return globals;
    }

    /**
     * 把本作用域的声明并入父作用域，子作用域改挂到父作用域下。
     *
     * <p>用于把代码片段的顶层语句直接插入宿主代码块：标识保持不变，只改变声明作用域。
     * 调用方负责把引用节点改写为父作用域，并在合并前改名与宿主同名的声明（见 {@link #uniqueName()}），
     * 否则打印出的程序会改变宿主引用的绑定。父作用域中已有的同名声明在按名字查找时优先。</p>
     */
    public void mergeIntoParent() {
        if (global || parent == null) {
            throw new ScopeConsistencyException("a global scope cannot be merged");
        }
        if (merged) {
            throw new ScopeConsistencyException(this + " has already been merged");
        }
        Scope target = parent;
        for (Map.Entry<SymbolId, String> e : variables.entrySet()) {
            target.variables.put(e.getKey(), e.getValue());
            if (!target.names.containsKey(e.getValue())) {
                target.names.put(e.getValue(), e.getKey());
            }
        }
        for (Map.Entry<SymbolId, Integer> e : referenceCounts.entrySet()) {
            Integer old = target.referenceCounts.get(e.getKey());
            target.referenceCounts.put(e.getKey(), old == null ? e.getValue() : old + e.getValue());
        }

        // 本作用域登记的引用都已沿链记在 target 及以上；后代中指向本作用域的账目改挂到 target
        List<Scope> descendants = new ArrayList<Scope>();
        collectSubtree(descendants);
        for (Scope s : descendants) {
            if (s == this) continue;
            Map<SymbolId, Integer> refs = s.higherReferences.remove(this);
            if (refs == null) continue;
            Map<SymbolId, Integer> rekeyed = s.higherReferences.get(target);
            if (rekeyed == null) {
                rekeyed = new LinkedHashMap<SymbolId, Integer>();
                s.higherReferences.put(target, rekeyed);
            }
            for (Map.Entry<SymbolId, Integer> e : refs.entrySet()) {
                Integer old = rekeyed.get(e.getKey());
                rekeyed.put(e.getKey(), old == null ? e.getValue() : old + e.getValue());
            }
        }

        int index = target.children.indexOf(this);
        target.children.remove(index);
        for (Scope child : children) {
            child.parent = target;
        }
        target.children.addAll(index, children);

        children.clear();
        variables.clear();
        names.clear();
        referenceCounts.clear();
        higherReferences.clear();
        merged = true;
    }

    private void collectSubtree(List<Scope> out) {
        out.add(this);
        for (Scope child : children) {
            child.collectSubtree(out);
        }
    }

    @Override
    public String toString() {
        return (global ? "global" : "scope") + "@" + getLevel() + variables.values();
    }
}
