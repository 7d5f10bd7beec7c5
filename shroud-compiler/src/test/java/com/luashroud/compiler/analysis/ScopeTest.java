package com.luashroud.compiler.analysis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Scope 单元测试
 */
class ScopeTest {

    // ============ 声明与查找 ============

    @Nested
    @DisplayName("声明与查找")
    class DeclarationTests {

        @Test
        @DisplayName("未指定名字时使用序号名")
        void testDefaultName() {
            Scope global = Scope.newGlobal();
            Scope local = new Scope(global);
            SymbolId id = local.addVariable();
            assertEquals("_" + id.getSerial(), local.getVariableName(id));
            assertTrue(local.isDeclared(id));
            assertFalse(global.isDeclared(id));
        }

        @Test
        @DisplayName("序号名避开树中已有的名字")
        void testDefaultNameAvoidsExistingNames() {
            Scope global = Scope.newGlobal();
            global.resolveGlobal("_2");
            Scope local = new Scope(global);
            local.addVariable("_3");
            SymbolId id = local.addVariable();
            String name = local.getVariableName(id);
            assertNotEquals("_2", name);
            assertNotEquals("_3", name);
            assertNotEquals(name, global.uniqueName());
        }

        @Test
        @DisplayName("uniqueName 避开挂接进来的子树中的名字")
        void testUniqueNameAfterAttach() {
            Scope host = Scope.newGlobal();
            Scope hostBlock = new Scope(host);
            Scope other = Scope.newGlobal();
            Scope fragment = new Scope(other);
            fragment.addVariable("_1");
            fragment.addVariable("_2");
            fragment.attachTo(hostBlock);
            String name = host.uniqueName();
            assertNotEquals("_1", name);
            assertNotEquals("_2", name);
        }

        @Test
        @DisplayName("同一棵树内标识序号唯一")
        void testUniqueSerials() {
            Scope global = Scope.newGlobal();
            Scope a = new Scope(global);
            Scope b = new Scope(a);
            SymbolId x = a.addVariable("x");
            SymbolId y = b.addVariable("x");
            assertNotSame(x, y);
            assertNotEquals(x.getSerial(), y.getSerial());
        }

        @Test
        @DisplayName("resolve 由内向外查找，遮蔽外层同名变量")
        void testResolveShadowing() {
            Scope global = Scope.newGlobal();
            Scope outer = new Scope(global);
            Scope inner = new Scope(outer);
            SymbolId outerX = outer.addVariable("x");
            SymbolId innerX = inner.addVariable("x");
            assertSame(innerX, inner.resolve("x").getId());
            assertSame(outerX, outer.resolve("x").getId());
            assertSame(outer, new Scope(outer).resolve("x").getScope());
        }

        @Test
        @DisplayName("resolve 不查全局，lookup 查已驻留的全局")
        void testGlobals() {
            Scope global = Scope.newGlobal();
            Scope local = new Scope(global);
            assertNull(local.resolve("print"));
            assertThrows(ScopeConsistencyException.class, () -> local.lookup("print"));

            Binding interned = local.resolveGlobal("print");
            assertTrue(interned.isGlobal());
            assertSame(global, interned.getScope());
            assertEquals(interned, local.lookup("print"));
            assertEquals(interned, local.resolveGlobal("print"));
            assertEquals(1, global.getVariables().size());
        }

        @Test
        @DisplayName("重命名后旧名字退回到先前的同名声明")
        void testRenameFallsBack() {
            Scope global = Scope.newGlobal();
            Scope local = new Scope(global);
            SymbolId first = local.addVariable("x");
            SymbolId second = local.addVariable("x");
            assertSame(second, local.resolveLocal("x"));

            local.renameVariable(second, "y");
            assertSame(first, local.resolveLocal("x"));
            assertSame(second, local.resolveLocal("y"));
            assertEquals("y", local.getVariableName(second));
        }

        @Test
        @DisplayName("全局变量不能重命名")
        void testRenameGlobal() {
            Scope global = Scope.newGlobal();
            SymbolId id = global.resolveGlobal("print").getId();
            assertThrows(ScopeConsistencyException.class, () -> global.renameVariable(id, "p"));
        }

        @Test
        @DisplayName("移除未声明的变量失败")
        void testRemoveUndeclared() {
            Scope global = Scope.newGlobal();
            Scope a = new Scope(global);
            Scope b = new Scope(global);
            SymbolId id = a.addVariable("x");
            assertThrows(ScopeConsistencyException.class, () -> b.removeVariable(id));
            a.removeVariable(id);
            assertFalse(a.isDeclared(id));
            assertNull(a.resolveLocal("x"));
        }

        @Test
        @DisplayName("层级与祖先关系")
        void testStructure() {
            Scope global = Scope.newGlobal();
            Scope a = new Scope(global);
            Scope b = new Scope(a);
            assertEquals(0, global.getLevel());
            assertEquals(2, b.getLevel());
            assertTrue(a.isAncestorOf(b));
            assertTrue(a.isAncestorOf(a));
            assertFalse(b.isAncestorOf(a));
            assertSame(global, b.getGlobalScope());
            assertEquals(1, global.getChildren().size());
            assertThrows(IllegalArgumentException.class, () -> new Scope(null));
        }
    }

    // ============ 引用账目 ============

    @Nested
    @DisplayName("引用账目")
    class LedgerTests {

        @Test
        @DisplayName("引用沿路径每一层登记，不含声明作用域")
        void testAddAlongPath() {
            Scope global = Scope.newGlobal();
            Scope owner = new Scope(global);
            Scope mid = new Scope(owner);
            Scope leaf = new Scope(mid);
            SymbolId x = owner.addVariable("x");

            leaf.addReferenceToHigherScope(owner, x, 2);
            assertEquals(2, owner.getReferenceCount(x));
            assertEquals(2, mid.getHigherReferenceCount(owner, x));
            assertEquals(2, leaf.getHigherReferenceCount(owner, x));
            assertEquals(0, owner.getHigherReferenceCount(owner, x));
        }

        @Test
        @DisplayName("本作用域内的引用只增加计数")
        void testOwnScopeReference() {
            Scope global = Scope.newGlobal();
            Scope owner = new Scope(global);
            SymbolId x = owner.addVariable("x");
            owner.addReferenceToHigherScope(owner, x);
            assertEquals(1, owner.getReferenceCount(x));
            assertTrue(owner.getHigherReferences().isEmpty());
        }

        @Test
        @DisplayName("移除是添加的逆操作")
        void testRemove() {
            Scope global = Scope.newGlobal();
            Scope owner = new Scope(global);
            Scope leaf = new Scope(owner);
            SymbolId x = owner.addVariable("x");
            leaf.addReferenceToHigherScope(owner, x, 3);
            leaf.removeReferenceToHigherScope(owner, x, 3);
            assertEquals(0, owner.getReferenceCount(x));
            assertEquals(0, leaf.getHigherReferenceCount(owner, x));
            assertTrue(leaf.getHigherReferences().isEmpty());
        }

        @Test
        @DisplayName("计数不足时拒绝移除且不修改状态")
        void testUnderflow() {
            Scope global = Scope.newGlobal();
            Scope owner = new Scope(global);
            Scope leaf = new Scope(owner);
            SymbolId x = owner.addVariable("x");
            leaf.addReferenceToHigherScope(owner, x);
            assertThrows(ScopeConsistencyException.class, () -> leaf.removeReferenceToHigherScope(owner, x, 2));
            assertEquals(1, owner.getReferenceCount(x));
            assertEquals(1, leaf.getHigherReferenceCount(owner, x));
        }

        @Test
        @DisplayName("owner 必须是祖先且声明了该变量")
        void testInvalidOwner() {
            Scope global = Scope.newGlobal();
            Scope a = new Scope(global);
            Scope b = new Scope(global);
            SymbolId x = a.addVariable("x");
            assertThrows(ScopeConsistencyException.class, () -> b.addReferenceToHigherScope(a, x));
            assertThrows(ScopeConsistencyException.class, () -> a.addReferenceToHigherScope(global, x));
            assertThrows(IllegalArgumentException.class, () -> a.addReferenceToHigherScope(a, x, 0));
        }

        @Test
        @DisplayName("账目视图只读")
        void testReadOnlyView() {
            Scope global = Scope.newGlobal();
            Scope owner = new Scope(global);
            Scope leaf = new Scope(owner);
            SymbolId x = owner.addVariable("x");
            leaf.addReferenceToHigherScope(owner, x);
            Map<Scope, Map<SymbolId, Integer>> view = leaf.getHigherReferences();
            assertThrows(UnsupportedOperationException.class, () -> view.clear());
            assertThrows(UnsupportedOperationException.class, () -> view.get(owner).put(x, 5));
        }
    }

    // ============ 挂接与合并 ============

    @Nested
    @DisplayName("挂接与合并")
    class AttachTests {

        @Test
        @DisplayName("挂接时全局引用按名字改挂到宿主全局作用域")
        void testAttachRekeysGlobals() {
            Scope hostGlobal = Scope.newGlobal();
            Scope host = new Scope(hostGlobal);
            SymbolId hostPrint = hostGlobal.resolveGlobal("print").getId();
            host.addReferenceToHigherScope(hostGlobal, hostPrint);

            Scope snippetGlobal = Scope.newGlobal();
            Scope snippet = new Scope(snippetGlobal);
            SymbolId snippetPrint = snippetGlobal.resolveGlobal("print").getId();
            SymbolId snippetType = snippetGlobal.resolveGlobal("type").getId();
            snippet.addReferenceToHigherScope(snippetGlobal, snippetPrint, 2);
            snippet.addReferenceToHigherScope(snippetGlobal, snippetType);

            Map<SymbolId, SymbolId> mapping = snippet.attachTo(host);

            assertSame(hostPrint, mapping.get(snippetPrint));
            SymbolId hostType = hostGlobal.resolveLocal("type");
            assertSame(hostType, mapping.get(snippetType));
            assertSame(host, snippet.getParent());
            assertSame(hostGlobal, snippet.getGlobalScope());
            assertTrue(host.getChildren().contains(snippet));
            assertFalse(snippetGlobal.getChildren().contains(snippet));

            assertEquals(3, hostGlobal.getReferenceCount(hostPrint));
            assertEquals(3, host.getHigherReferenceCount(hostGlobal, hostPrint));
            assertEquals(2, snippet.getHigherReferenceCount(hostGlobal, hostPrint));
            assertEquals(1, hostGlobal.getReferenceCount(hostType));
            assertEquals(0, snippetGlobal.getReferenceCount(snippetPrint));
        }

        @Test
        @DisplayName("子树内的局部标识保持不变")
        void testAttachKeepsLocals() {
            Scope hostGlobal = Scope.newGlobal();
            Scope host = new Scope(hostGlobal);
            Scope snippetGlobal = Scope.newGlobal();
            Scope snippet = new Scope(snippetGlobal);
            Scope inner = new Scope(snippet);
            SymbolId x = snippet.addVariable("x");
            inner.addReferenceToHigherScope(snippet, x);

            snippet.attachTo(host);
            assertTrue(snippet.isDeclared(x));
            assertEquals(1, inner.getHigherReferenceCount(snippet, x));
            assertEquals(0, host.getHigherReferenceCount(snippet, x));
        }

        @Test
        @DisplayName("只能挂接一次，全局作用域不能挂接")
        void testAttachTwice() {
            Scope hostGlobal = Scope.newGlobal();
            Scope host = new Scope(hostGlobal);
            Scope snippet = new Scope(Scope.newGlobal());
            snippet.attachTo(host);
            Scope other = new Scope(Scope.newGlobal());
            assertThrows(ScopeConsistencyException.class, () -> snippet.attachTo(other));
            assertThrows(ScopeConsistencyException.class, () -> Scope.newGlobal().attachTo(host));
            assertThrows(ScopeConsistencyException.class, () -> new Scope(hostGlobal).attachTo(host));
        }

        @Test
        @DisplayName("引用了未挂接祖先的子树被拒绝")
        void testAttachDanglingReference() {
            Scope hostGlobal = Scope.newGlobal();
            Scope host = new Scope(hostGlobal);
            Scope snippetGlobal = Scope.newGlobal();
            Scope outer = new Scope(snippetGlobal);
            Scope inner = new Scope(outer);
            SymbolId x = outer.addVariable("x");
            inner.addReferenceToHigherScope(outer, x);

            assertThrows(ScopeConsistencyException.class, () -> inner.attachTo(host));
            assertSame(outer, inner.getParent());
        }

        @Test
        @DisplayName("合并后声明和账目移到父作用域")
        void testMergeIntoParent() {
            Scope global = Scope.newGlobal();
            Scope parent = new Scope(global);
            Scope merged = new Scope(parent);
            Scope child = new Scope(merged);
            SymbolId x = merged.addVariable("x");
            child.addReferenceToHigherScope(merged, x, 2);

            merged.mergeIntoParent();

            assertTrue(merged.isMerged());
            assertTrue(parent.isDeclared(x));
            assertSame(x, parent.resolveLocal("x"));
            assertEquals(2, parent.getReferenceCount(x));
            assertEquals(2, child.getHigherReferenceCount(parent, x));
            assertSame(parent, child.getParent());
            assertTrue(parent.getChildren().contains(child));
            assertFalse(parent.getChildren().contains(merged));
            assertThrows(ScopeConsistencyException.class, merged::mergeIntoParent);
        }

        @Test
        @DisplayName("合并时父作用域已有的同名声明优先")
        void testMergeNameConflict() {
            Scope global = Scope.newGlobal();
            Scope parent = new Scope(global);
            SymbolId existing = parent.addVariable("x");
            Scope merged = new Scope(parent);
            SymbolId incoming = merged.addVariable("x");
            merged.mergeIntoParent();
            assertSame(existing, parent.resolveLocal("x"));
            assertTrue(parent.isDeclared(incoming));
        }
    }
}
