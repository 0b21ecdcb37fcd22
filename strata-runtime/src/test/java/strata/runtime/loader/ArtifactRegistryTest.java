package strata.runtime.loader;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import strata.api.ClassLoaderTier;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("产物注册表与分层加载器测试")
class ArtifactRegistryTest {

    @TempDir
    Path dir;

    private ArtifactRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ArtifactRegistry(ArtifactRegistryTest.class.getClassLoader(), Collections.<Path>emptyList());
    }

    /** 生成一个带 public 无参构造的空类 */
    private static byte[] emptyClass(String internalName) {
        ClassWriter cw = new ClassWriter(ClassWriter.COMPUTE_MAXS);
        cw.visit(Opcodes.V11, Opcodes.ACC_PUBLIC | Opcodes.ACC_SUPER, internalName, null, "java/lang/Object", null);
        MethodVisitor init = cw.visitMethod(Opcodes.ACC_PUBLIC, "<init>", "()V", null, null);
        init.visitCode();
        init.visitVarInsn(Opcodes.ALOAD, 0);
        init.visitMethodInsn(Opcodes.INVOKESPECIAL, "java/lang/Object", "<init>", "()V", false);
        init.visitInsn(Opcodes.RETURN);
        init.visitMaxs(0, 0);
        init.visitEnd();
        cw.visitEnd();
        return cw.toByteArray();
    }

    @Nested
    @DisplayName("产物加载")
    class Artifacts {

        @Test
        @DisplayName("内存产物由运行时加载器定义")
        void testArtifactDefined() throws Exception {
            registry.addArtifact("gen.Hello", emptyClass("gen/Hello"));
            ClassLoader loader = registry.currentLoader(ClassLoaderTier.RUNTIME);

            Class<?> hello = loader.loadClass("gen.Hello");
            assertSame(loader, hello.getClassLoader());
            assertNotNull(registry.lookupArtifact("gen.Hello"));
            assertThat(registry.dynamicClasses()).containsKey("gen.Hello");
        }

        @Test
        @DisplayName("追加 classpath 后已加载类保持同一身份")
        void testIdentityAcrossLayers() throws Exception {
            registry.addArtifact("gen.Hello", emptyClass("gen/Hello"));
            ClassLoader first = registry.currentLoader(ClassLoaderTier.RUNTIME);
            Class<?> before = first.loadClass("gen.Hello");

            Files.createDirectories(dir.resolve("gen"));
            Files.write(dir.resolve("gen/Other.class"), emptyClass("gen/Other"));
            registry.addPaths(ClassLoaderTier.RUNTIME, Collections.singletonList(dir));

            ClassLoader second = registry.currentLoader(ClassLoaderTier.RUNTIME);
            assertNotSame(first, second);
            assertSame(before, second.loadClass("gen.Hello"));
            assertEquals("gen.Other", second.loadClass("gen.Other").getName());
        }

        @Test
        @DisplayName("旧层与新层请求同一产物得到同一个类")
        void testSingleDefinerAcrossLayers() throws Exception {
            registry.addArtifact("gen.A", emptyClass("gen/A"));
            ClassLoader lower = registry.currentLoader(ClassLoaderTier.RUNTIME);
            lower.loadClass("gen.A");

            registry.addPaths(ClassLoaderTier.RUNTIME, Collections.singletonList(Files.createDirectories(dir.resolve("extra"))));
            ClassLoader upper = registry.currentLoader(ClassLoaderTier.RUNTIME);
            registry.addArtifact("gen.B", emptyClass("gen/B"));

            Class<?> viaUpper = upper.loadClass("gen.B");
            Class<?> viaLower = lower.loadClass("gen.B");
            assertSame(viaUpper, viaLower);
            assertSame(upper, viaLower.getClassLoader());
        }

        @Test
        @DisplayName("旧层先请求新产物时也由最上层定义")
        void testLowerLayerDelegatesDefinition() throws Exception {
            ClassLoader lower = registry.currentLoader(ClassLoaderTier.RUNTIME);
            registry.addPaths(ClassLoaderTier.RUNTIME, Collections.singletonList(Files.createDirectories(dir.resolve("extra"))));
            ClassLoader upper = registry.currentLoader(ClassLoaderTier.RUNTIME);
            registry.addArtifact("gen.C", emptyClass("gen/C"));

            Class<?> viaLower = lower.loadClass("gen.C");
            assertSame(upper, viaLower.getClassLoader());
            assertSame(viaLower, upper.loadClass("gen.C"));
        }

        @Test
        @DisplayName("编译器内部加载器看不到内存产物")
        void testCompilerLoaderIsolated() {
            registry.addArtifact("gen.Hello", emptyClass("gen/Hello"));
            ClassLoader compiler = registry.currentLoader(ClassLoaderTier.COMPILER_INTERNAL);
            assertThrows(ClassNotFoundException.class, () -> compiler.loadClass("gen.Hello"));
        }

        @Test
        @DisplayName("记录包装类源码")
        void testSources() {
            registry.recordSource("$sess.cmd0", "class cmd0 {}");
            assertEquals("class cmd0 {}", registry.sources().get("$sess.cmd0"));
        }
    }

    @Nested
    @DisplayName("classpath 根")
    class Roots {

        @Test
        @DisplayName("忽略不存在与重复的路径")
        void testFiltering() throws Exception {
            Path a = Files.createDirectories(dir.resolve("a"));
            Path missing = dir.resolve("missing");

            List<Path> added = registry.addPaths(ClassLoaderTier.RUNTIME, Arrays.asList(a, missing, a));
            assertEquals(Collections.singletonList(a.toAbsolutePath().normalize()), added);
            assertThat(registry.addPaths(ClassLoaderTier.RUNTIME, Collections.singletonList(a))).isEmpty();
            assertEquals(1, registry.paths(ClassLoaderTier.RUNTIME).size());
        }

        @Test
        @DisplayName("追加时通知观察者")
        void testObserver() throws Exception {
            List<ClassLoaderTier> seen = new ArrayList<>();
            registry.onPathsAdded((tier, paths) -> seen.add(tier));

            registry.addPaths(ClassLoaderTier.PLUGIN, Collections.singletonList(Files.createDirectories(dir.resolve("p"))));
            assertEquals(Collections.singletonList(ClassLoaderTier.PLUGIN), seen);
        }

        @Test
        @DisplayName("编译 classpath 只在共享模式下包含编译器内部根")
        void testClasspathTiers() throws Exception {
            Path runtime = Files.createDirectories(dir.resolve("r"));
            Path compiler = Files.createDirectories(dir.resolve("c"));
            registry.addPaths(ClassLoaderTier.RUNTIME, Collections.singletonList(runtime));
            registry.addPaths(ClassLoaderTier.COMPILER_INTERNAL, Collections.singletonList(compiler));

            assertThat(registry.classpath()).contains(runtime.toAbsolutePath().normalize())
                    .doesNotContain(compiler.toAbsolutePath().normalize());
            registry.setSharedCompileExecuteMode(true);
            assertThat(registry.classpath()).contains(compiler.toAbsolutePath().normalize());
        }

        @Test
        @DisplayName("插件加载器以编译器内部加载器为父")
        void testPluginParent() {
            assertSame(registry.currentLoader(ClassLoaderTier.COMPILER_INTERNAL),
                    registry.pluginClassLoader().getParent());
        }
    }

    @Nested
    @DisplayName("共享模式切换")
    class SharedMode {

        @Test
        @DisplayName("运行时加载器尚未构建时切换不替换任何东西")
        void testSwitchBeforeMaterialized() {
            assertFalse(registry.setSharedCompileExecuteMode(true));
            assertTrue(registry.isSharedCompileExecuteMode());
            assertEquals(0, registry.generation());
            assertSame(registry.currentLoader(ClassLoaderTier.RUNTIME),
                    registry.currentLoader(ClassLoaderTier.COMPILER_INTERNAL));
        }

        @Test
        @DisplayName("重复设置同一模式无效果")
        void testSameModeNoop() {
            registry.currentLoader(ClassLoaderTier.RUNTIME);
            assertFalse(registry.setSharedCompileExecuteMode(false));
        }

        @Test
        @DisplayName("切换废弃旧加载器并清空产物")
        void testSwapInvalidates() throws Exception {
            registry.addArtifact("gen.Hello", emptyClass("gen/Hello"));
            registry.recordSource("gen.Hello", "// hello");
            ClassLoader old = registry.currentLoader(ClassLoaderTier.RUNTIME);
            old.loadClass("gen.Hello");

            assertTrue(registry.setSharedCompileExecuteMode(true));
            assertEquals(1, registry.generation());
            assertThrows(ClassNotFoundException.class, () -> old.loadClass("gen.Hello"));
            assertThat(registry.artifacts()).isEmpty();
            assertThat(registry.sources()).isEmpty();

            ClassLoader fresh = registry.currentLoader(ClassLoaderTier.RUNTIME);
            assertNotSame(old, fresh);
            assertSame(fresh, registry.currentLoader(ClassLoaderTier.COMPILER_INTERNAL));
            assertThat(fresh.toString()).contains("shared");
        }

        @Test
        @DisplayName("追加过 classpath 的旧加载器在切换后同样失效")
        void testSwapAfterAddPaths() throws Exception {
            registry.addArtifact("gen.Hello", emptyClass("gen/Hello"));
            registry.currentLoader(ClassLoaderTier.RUNTIME).loadClass("gen.Hello");
            registry.addPaths(ClassLoaderTier.RUNTIME, Collections.singletonList(Files.createDirectories(dir.resolve("extra"))));
            ClassLoader old = registry.currentLoader(ClassLoaderTier.RUNTIME);
            assertNotNull(old.loadClass("gen.Hello"));

            assertTrue(registry.setSharedCompileExecuteMode(true));
            assertThrows(ClassNotFoundException.class, () -> old.loadClass("gen.Hello"));
            assertThat(old.toString()).contains("discarded");
        }

        @Test
        @DisplayName("切换后新编译的产物不会被旧加载器定义")
        void testDiscardedLoaderRefusesNewArtifacts() throws Exception {
            ClassLoader old = registry.currentLoader(ClassLoaderTier.RUNTIME);
            assertTrue(registry.setSharedCompileExecuteMode(true));

            registry.addArtifact("gen.Fresh", emptyClass("gen/Fresh"));
            assertThrows(ClassNotFoundException.class, () -> old.loadClass("gen.Fresh"));
            assertEquals("gen.Fresh", registry.currentLoader(ClassLoaderTier.RUNTIME).loadClass("gen.Fresh").getName());
        }
    }

    @Test
    @DisplayName("宿主 classpath 包含 API 所在位置")
    void testDetectHostClasspath() {
        assertThat(ArtifactRegistry.detectHostClasspath()).isNotEmpty();
    }
}
