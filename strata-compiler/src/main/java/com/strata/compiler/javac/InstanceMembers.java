package com.strata.compiler.javac;

import com.sun.source.tree.ClassTree;
import com.sun.source.tree.CompilationUnitTree;
import com.sun.source.tree.ExpressionTree;
import com.sun.source.tree.IdentifierTree;
import com.sun.source.tree.MemberSelectTree;
import com.sun.source.tree.Tree;
import com.sun.source.tree.VariableTree;
import com.sun.source.util.JavacTask;
import com.sun.source.util.SourcePositions;
import com.sun.source.util.TreePath;
import com.sun.source.util.TreePathScanner;
import com.sun.source.util.Trees;

import javax.lang.model.element.Element;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.lang.model.element.TypeParameterElement;
import javax.lang.model.element.VariableElement;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.ElementFilter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 实例包装行之间的成员衔接，在归因通过之后、生成字节码之前改写源码。
 *
 * <p>其他行的实例字段以私有别名 {@code private T x = prefix.INSTANCE.x;} 引入，只用于归因。
 * 别名的每个引用改写为 {@code prefix.INSTANCE.x} 本身，别名声明随之删除，赋值因此落在原来的字段上。</p>
 *
 * <p>包装类的 public 实例方法在嵌套类 {@value #HOLDER} 中得到同签名的静态转发方法，
 * 其他行通过静态导入调用它们。</p>
 */
final class InstanceMembers {

    /** 静态转发方法所在的嵌套类 */
    static final String HOLDER = "$Members";

    private static final String INSTANCE = "INSTANCE";

    private InstanceMembers() {
    }

    /**
     * @return 需要的源码替换；为空表示源码已无需改写
     */
    static List<PlaceholderInference.Edit> rewrite(JavacTask task, CompilationUnitTree unit, String source,
                                                   String moduleClass) {
        Trees trees = Trees.instance(task);
        List<PlaceholderInference.Edit> edits = new ArrayList<>();
        for (Tree decl : unit.getTypeDecls()) {
            if (!(decl instanceof ClassTree)) continue;
            TreePath classPath = new TreePath(new TreePath(unit), decl);
            Element element = trees.getElement(classPath);
            if (element instanceof TypeElement
                    && ((TypeElement) element).getQualifiedName().contentEquals(moduleClass)) {
                aliasEdits(trees, unit, source, classPath, edits);
                forwarders(trees, unit, (TypeElement) element, classPath, edits);
            }
        }
        return edits;
    }

    private static void aliasEdits(Trees trees, CompilationUnitTree unit, String source, TreePath classPath,
                                   List<PlaceholderInference.Edit> edits) {
        SourcePositions positions = trees.getSourcePositions();
        Map<Element, String> targets = new HashMap<>();
        Set<Tree> aliases = new HashSet<>();
        for (Tree member : ((ClassTree) classPath.getLeaf()).getMembers()) {
            if (!(member instanceof VariableTree)) continue;
            VariableTree field = (VariableTree) member;
            if (!isAlias(field)) continue;
            int start = (int) positions.getStartPosition(unit, field);
            int end = (int) positions.getEndPosition(unit, field);
            int initStart = (int) positions.getStartPosition(unit, field.getInitializer());
            int initEnd = (int) positions.getEndPosition(unit, field.getInitializer());
            if (start < 0 || end < 0 || initStart < 0 || initEnd < 0) continue;
            Element element = trees.getElement(new TreePath(classPath, field));
            if (element == null) continue;
            targets.put(element, source.substring(initStart, initEnd));
            aliases.add(field);
            edits.add(new PlaceholderInference.Edit(start, end, ""));
        }
        if (targets.isEmpty()) {
            return;
        }

        new TreePathScanner<Void, Void>() {
            @Override
            public Void visitVariable(VariableTree node, Void unused) {
                if (aliases.contains(node)) {
                    return null;
                }
                return super.visitVariable(node, unused);
            }

            @Override
            public Void visitIdentifier(IdentifierTree node, Void unused) {
                replace(node);
                return null;
            }

            @Override
            public Void visitMemberSelect(MemberSelectTree node, Void unused) {
                // this.x
                if (node.getExpression() instanceof IdentifierTree
                        && ((IdentifierTree) node.getExpression()).getName().contentEquals("this")
                        && replace(node)) {
                    return null;
                }
                return super.visitMemberSelect(node, unused);
            }

            private boolean replace(Tree node) {
                String target = targets.get(trees.getElement(getCurrentPath()));
                if (target == null) {
                    return false;
                }
                int start = (int) positions.getStartPosition(unit, node);
                int end = (int) positions.getEndPosition(unit, node);
                if (start < 0 || end < 0) {
                    return false;
                }
                edits.add(new PlaceholderInference.Edit(start, end, target));
                return true;
            }
        }.scan(unit, null);
    }

    /**
     * {@code private T x = <prefix>.INSTANCE.x;}
     */
    private static boolean isAlias(VariableTree field) {
        if (!field.getModifiers().getFlags().contains(Modifier.PRIVATE)) {
            return false;
        }
        ExpressionTree init = field.getInitializer();
        if (!(init instanceof MemberSelectTree)) {
            return false;
        }
        MemberSelectTree select = (MemberSelectTree) init;
        return select.getIdentifier().contentEquals(field.getName())
                && select.getExpression() instanceof MemberSelectTree
                && ((MemberSelectTree) select.getExpression()).getIdentifier().contentEquals(INSTANCE);
    }

    private static void forwarders(Trees trees, CompilationUnitTree unit, TypeElement module, TreePath classPath,
                                   List<PlaceholderInference.Edit> edits) {
        List<ExecutableElement> methods = new ArrayList<>();
        for (Element member : module.getEnclosedElements()) {
            if (member.getSimpleName().contentEquals(HOLDER)) {
                return;
            }
        }
        for (ExecutableElement method : ElementFilter.methodsIn(module.getEnclosedElements())) {
            Set<Modifier> modifiers = method.getModifiers();
            if (modifiers.contains(Modifier.PUBLIC) && !modifiers.contains(Modifier.STATIC)
                    && !method.getSimpleName().toString().startsWith("$")) {
                methods.add(method);
            }
        }
        if (methods.isEmpty()) {
            return;
        }
        int end = (int) trees.getSourcePositions().getEndPosition(unit, classPath.getLeaf());
        if (end <= 0) {
            return;
        }
        String instance = module.getQualifiedName() + "." + INSTANCE;
        StringBuilder sb = new StringBuilder();
        sb.append("\n    public static final class ").append(HOLDER).append(" {\n");
        sb.append("        private ").append(HOLDER).append("() {\n        }\n");
        for (ExecutableElement method : methods) {
            sb.append(forwarder(method, instance));
        }
        sb.append("    }\n");
        // 插在类体的右花括号之前
        edits.add(new PlaceholderInference.Edit(end - 1, end - 1, sb.toString()));
    }

    private static String forwarder(ExecutableElement method, String instance) {
        StringBuilder sb = new StringBuilder("        public static ");
        List<? extends TypeParameterElement> typeParameters = method.getTypeParameters();
        if (!typeParameters.isEmpty()) {
            sb.append('<');
            for (int i = 0; i < typeParameters.size(); i++) {
                if (i > 0) sb.append(", ");
                TypeParameterElement parameter = typeParameters.get(i);
                sb.append(parameter.getSimpleName());
                String separator = " extends ";
                for (TypeMirror bound : parameter.getBounds()) {
                    if (bound.toString().equals("java.lang.Object")) continue;
                    sb.append(separator).append(bound);
                    separator = " & ";
                }
            }
            sb.append("> ");
        }
        sb.append(method.getReturnType()).append(' ').append(method.getSimpleName()).append('(');
        List<? extends VariableElement> parameters = method.getParameters();
        StringBuilder args = new StringBuilder();
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) {
                sb.append(", ");
                args.append(", ");
            }
            String type = parameters.get(i).asType().toString();
            if (method.isVarArgs() && i == parameters.size() - 1 && type.endsWith("[]")) {
                type = type.substring(0, type.length() - 2) + "...";
            }
            sb.append(type).append(' ').append(parameters.get(i).getSimpleName());
            args.append(parameters.get(i).getSimpleName());
        }
        sb.append(')');
        List<? extends TypeMirror> thrown = method.getThrownTypes();
        for (int i = 0; i < thrown.size(); i++) {
            sb.append(i == 0 ? " throws " : ", ").append(thrown.get(i));
        }
        sb.append(" {\n            ");
        if (method.getReturnType().getKind() != TypeKind.VOID) {
            sb.append("return ");
        }
        sb.append(instance).append('.').append(method.getSimpleName()).append('(').append(args).append(");\n");
        sb.append("        }\n");
        return sb.toString();
    }
}
