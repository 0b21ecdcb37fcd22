package com.strata.compiler.javac;

import com.sun.source.tree.ClassTree;
import com.sun.source.tree.CompilationUnitTree;
import com.sun.source.tree.ExpressionTree;
import com.sun.source.tree.IdentifierTree;
import com.sun.source.tree.MemberSelectTree;
import com.sun.source.tree.MethodInvocationTree;
import com.sun.source.tree.VariableTree;
import com.sun.source.util.JavacTask;
import com.sun.source.util.SourcePositions;
import com.sun.source.util.TreePath;
import com.sun.source.util.TreePathScanner;
import com.sun.source.util.Trees;
import strata.api.Infer;
import strata.api.Unit;

import javax.lang.model.element.Element;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.NestingKind;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.Types;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 把类型为 {@link Infer} 的包装类字段替换为初始化表达式的真实类型。
 *
 * <p>先在只做过语法分析的树上把占位类型换成等长的 {@link #ATTRIBUTION_TYPE}，初始化表达式于是按普通的
 * Object 赋值归因，保留自身类型；之后每轮归因只替换初始化表达式已可归因的字段，依赖其他占位字段的表达式要等下一轮。</p>
 */
final class PlaceholderInference {

    /** 归因时代替占位类型，与 {@link Infer#TYPE_NAME} 等长，替换不移动任何源码位置 */
    static final String ATTRIBUTION_TYPE = "java.lang.Object";

    /** 源码替换：[start, end) → text */
    static final class Edit {
        final int start;
        final int end;
        final String text;

        Edit(int start, int end, String text) {
            this.start = start;
            this.end = end;
            this.text = text;
        }
    }

    /** 一轮扫描的结果 */
    static final class Pass {
        final List<Edit> edits = new ArrayList<>();
        /** 本轮涉及的占位字段名：替换阶段为全部占位字段，推断阶段为已推断出的字段 */
        final Set<String> names = new LinkedHashSet<>();
        /** 仍无法推断的字段名 */
        final List<String> unresolved = new ArrayList<>();
        /** 无法推断的初始化表达式范围 [start, end) */
        final List<int[]> unresolvedSpans = new ArrayList<>();
    }

    private PlaceholderInference() {
    }

    /**
     * 找出包装类中的占位字段，生成把占位类型换成 {@link #ATTRIBUTION_TYPE} 的替换
     *
     * @param unit 只做过语法分析的编译单元
     */
    static Pass substitute(JavacTask task, CompilationUnitTree unit) {
        SourcePositions positions = Trees.instance(task).getSourcePositions();
        Pass pass = new Pass();
        new TreePathScanner<Void, Void>() {
            @Override
            public Void visitVariable(VariableTree node, Void unused) {
                if (isModuleField(getCurrentPath()) && node.getType() != null
                        && Infer.TYPE_NAME.equals(node.getType().toString())) {
                    int typeStart = (int) positions.getStartPosition(unit, node.getType());
                    if (typeStart >= 0) {
                        pass.names.add(node.getName().toString());
                        pass.edits.add(new Edit(typeStart, typeStart + Infer.TYPE_NAME.length(), ATTRIBUTION_TYPE));
                    }
                }
                return super.visitVariable(node, unused);
            }
        }.scan(unit, null);
        return pass;
    }

    /**
     * 为 {@code pending} 中仍待推断的字段生成类型替换
     */
    static Pass scan(JavacTask task, CompilationUnitTree unit, String source, Set<String> pending) {
        Trees trees = Trees.instance(task);
        Types types = task.getTypes();
        SourcePositions positions = trees.getSourcePositions();
        Pass pass = new Pass();

        // 待推断字段此时按 Object 归因，引用它们的初始化表达式要等它们先确定
        Set<Element> pendingFields = new HashSet<>();
        new TreePathScanner<Void, Void>() {
            @Override
            public Void visitVariable(VariableTree node, Void unused) {
                if (pending.contains(node.getName().toString()) && isModuleField(getCurrentPath())) {
                    pendingFields.add(trees.getElement(getCurrentPath()));
                }
                return super.visitVariable(node, unused);
            }
        }.scan(unit, null);

        new TreePathScanner<Void, Void>() {
            @Override
            public Void visitVariable(VariableTree node, Void unused) {
                if (pending.contains(node.getName().toString()) && isModuleField(getCurrentPath())) {
                    infer(node);
                }
                return super.visitVariable(node, unused);
            }

            private void infer(VariableTree node) {
                String name = node.getName().toString();
                ExpressionTree init = node.getInitializer();
                if (init == null) {
                    pass.unresolved.add(name);
                    return;
                }
                TreePath initPath = new TreePath(getCurrentPath(), init);
                if (references(trees, initPath, pendingFields)) {
                    pass.unresolved.add(name);
                    return;
                }
                TypeMirror type = trees.getTypeMirror(initPath);
                int typeStart = (int) positions.getStartPosition(unit, node.getType());
                int typeEnd = typeStart + ATTRIBUTION_TYPE.length();
                int initStart = (int) positions.getStartPosition(unit, init);
                int initEnd = (int) positions.getEndPosition(unit, init);
                if (typeStart < 0 || initStart < 0 || initEnd < 0) {
                    pass.unresolved.add(name);
                    return;
                }
                if ((type != null && type.getKind() == TypeKind.VOID) || returnsVoid(trees, initPath)) {
                    pass.names.add(name);
                    pass.edits.add(new Edit(typeStart, typeEnd, Unit.TYPE_NAME));
                    pass.edits.add(new Edit(initStart, initEnd,
                            Unit.TYPE_NAME + ".of(() -> " + source.substring(initStart, initEnd) + ")"));
                    return;
                }
                if (type == null || type.getKind() == TypeKind.ERROR) {
                    pass.unresolved.add(name);
                    pass.unresolvedSpans.add(new int[]{initStart, initEnd});
                    return;
                }
                pass.names.add(name);
                pass.edits.add(new Edit(typeStart, typeEnd, denotable(type, types)));
            }
        }.scan(unit, null);
        return pass;
    }

    /**
     * 包装类（编译单元的顶层类）直接声明的字段
     */
    private static boolean isModuleField(TreePath path) {
        TreePath owner = path.getParentPath();
        return owner != null && owner.getLeaf() instanceof ClassTree
                && owner.getParentPath() != null && owner.getParentPath().getLeaf() instanceof CompilationUnitTree;
    }

    private static boolean references(Trees trees, TreePath path, Set<Element> fields) {
        boolean[] found = new boolean[1];
        new TreePathScanner<Void, Void>() {
            @Override
            public Void visitIdentifier(IdentifierTree node, Void unused) {
                if (fields.contains(trees.getElement(getCurrentPath()))) {
                    found[0] = true;
                }
                return null;
            }

            @Override
            public Void visitMemberSelect(MemberSelectTree node, Void unused) {
                if (fields.contains(trees.getElement(getCurrentPath()))) {
                    found[0] = true;
                }
                return super.visitMemberSelect(node, unused);
            }
        }.scan(path, null);
        return found[0];
    }

    /**
     * 返回 void 的方法调用赋给 Object 时归因为错误类型，从被调用的方法上认出它
     */
    private static boolean returnsVoid(Trees trees, TreePath initPath) {
        if (!(initPath.getLeaf() instanceof MethodInvocationTree)) {
            return false;
        }
        MethodInvocationTree call = (MethodInvocationTree) initPath.getLeaf();
        Element method = trees.getElement(new TreePath(initPath, call.getMethodSelect()));
        return method instanceof ExecutableElement
                && ((ExecutableElement) method).getReturnType().getKind() == TypeKind.VOID;
    }

    /**
     * 转成可以写在源码里的类型
     */
    static String denotable(TypeMirror type, Types types) {
        switch (type.getKind()) {
            case NULL:
                return "java.lang.Object";
            case INTERSECTION:
                return types.erasure(type).toString();
            case DECLARED:
                Element element = ((DeclaredType) type).asElement();
                if (element instanceof TypeElement) {
                    NestingKind nesting = ((TypeElement) element).getNestingKind();
                    if (nesting == NestingKind.ANONYMOUS || nesting == NestingKind.LOCAL) {
                        return denotable(supertypeOf((TypeElement) element), types);
                    }
                }
                String text = type.toString();
                if (text.contains("capture#") || text.contains("<anonymous")) {
                    return types.erasure(type).toString();
                }
                return text;
            default:
                return type.toString();
        }
    }

    private static TypeMirror supertypeOf(TypeElement element) {
        TypeMirror superclass = element.getSuperclass();
        // 匿名类实现接口时，父类是 Object
        if (!element.getInterfaces().isEmpty()
                && superclass.toString().equals("java.lang.Object")) {
            return element.getInterfaces().get(0);
        }
        return superclass;
    }

    static String apply(String source, List<Edit> edits) {
        List<Edit> sorted = new ArrayList<>(edits);
        sorted.sort((a, b) -> Integer.compare(b.start, a.start));
        StringBuilder sb = new StringBuilder(source);
        for (Edit edit : sorted) {
            sb.replace(edit.start, edit.end, edit.text);
        }
        return sb.toString();
    }
}
