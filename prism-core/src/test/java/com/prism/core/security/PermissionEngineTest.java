package com.prism.core.security;

import com.prism.api.exception.ConfigurationException;
import com.prism.api.sandbox.GovernedOperations;
import com.prism.api.security.Capabilities;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PermissionEngine 单元测试")
class PermissionEngineTest {

    private PermissionEngine engine;

    @BeforeEach
    void setUp() {
        engine = PermissionEngine.withDefaults();
    }

    @Nested
    @DisplayName("注册与冻结")
    class RegistrationTests {

        @Test
        @DisplayName("默认引擎包含全部内置能力并已冻结")
        void defaultsShouldBeRegisteredAndFrozen() {
            assertTrue(engine.isFrozen());
            for (String name : List.of(Capabilities.FILE_READ_PLUGIN, Capabilities.FILE_WRITE_PLUGIN,
                    Capabilities.NETWORK_HTTPS, Capabilities.NETWORK_HTTP,
                    Capabilities.API_CREATE_ROUTE, Capabilities.SYSTEM_SUBPROCESS)) {
                assertTrue(engine.isValidPermissionType(name), name);
            }
            assertEquals(6, engine.definitions().size());
        }

        @Test
        @DisplayName("冻结后注册应失败")
        void registerAfterFreezeShouldFail() {
            CapabilityDefinition extra = CapabilityDefinition.builder()
                    .name("custom.cap").type("custom").build();
            assertThrows(IllegalStateException.class, () -> engine.register(extra));
            assertFalse(engine.isValidPermissionType("custom.cap"));
        }

        @Test
        @DisplayName("重复名称注册应失败")
        void duplicateNameShouldFail() {
            PermissionEngine fresh = new PermissionEngine();
            PermissionEngine.registerDefaults(fresh);
            CapabilityDefinition dup = CapabilityDefinition.builder()
                    .name(Capabilities.NETWORK_HTTP).type("network").build();
            assertThrows(ConfigurationException.class, () -> fresh.register(dup));
        }

        @Test
        @DisplayName("未知能力查询返回空")
        void unknownDefinitionShouldBeEmpty() {
            assertTrue(engine.getDefinition("nope").isEmpty());
            assertFalse(engine.isValidPermissionType("nope"));
        }
    }

    @Nested
    @DisplayName("事件映射")
    class MappingTests {

        @Test
        @DisplayName("读模式打开文件只需要读能力")
        void readOpenShouldMapToRead() {
            Set<String> required = engine.mapEventToPermissions(GovernedOperations.FILE_OPEN, Path.of("a.txt"), "r");
            assertEquals(Set.of(Capabilities.FILE_READ_PLUGIN), required);
        }

        @Test
        @DisplayName("写模式与追加模式打开文件需要写能力")
        void writeOpenShouldMapToWrite() {
            assertEquals(Set.of(Capabilities.FILE_WRITE_PLUGIN),
                    engine.mapEventToPermissions(GovernedOperations.FILE_OPEN, Path.of("a.txt"), "w"));
            assertEquals(Set.of(Capabilities.FILE_WRITE_PLUGIN),
                    engine.mapEventToPermissions(GovernedOperations.FILE_OPEN, Path.of("a.txt"), "a"));
        }

        @Test
        @DisplayName("读写模式可由任一能力满足")
        void readWriteModeShouldMapToBoth() {
            Set<String> required = engine.mapEventToPermissions(GovernedOperations.FILE_OPEN, Path.of("a.txt"), "r+");
            assertEquals(Set.of(Capabilities.FILE_READ_PLUGIN, Capabilities.FILE_WRITE_PLUGIN), required);
        }

        @Test
        @DisplayName("重命名与删除需要写能力")
        void renameAndDeleteShouldMapToWrite() {
            assertEquals(Set.of(Capabilities.FILE_WRITE_PLUGIN),
                    engine.mapEventToPermissions(GovernedOperations.FILE_RENAME, Path.of("a"), Path.of("b")));
            assertEquals(Set.of(Capabilities.FILE_WRITE_PLUGIN),
                    engine.mapEventToPermissions(GovernedOperations.FILE_DELETE, Path.of("a")));
        }

        @Test
        @DisplayName("按端口区分 HTTP 与 HTTPS")
        void socketConnectShouldMapByPort() {
            assertEquals(Set.of(Capabilities.NETWORK_HTTPS),
                    engine.mapEventToPermissions(GovernedOperations.SOCKET_CONNECT, "example.com", 443));
            assertEquals(Set.of(Capabilities.NETWORK_HTTP),
                    engine.mapEventToPermissions(GovernedOperations.SOCKET_CONNECT, "example.com", 80));
        }

        @Test
        @DisplayName("受控事件但判别值不匹配时返回空集")
        void unmatchedDiscriminatorShouldYieldEmpty() {
            assertTrue(engine.mapEventToPermissions(GovernedOperations.SOCKET_CONNECT, "example.com", 5432).isEmpty());
        }

        @Test
        @DisplayName("进程事件按前缀匹配")
        void processEventsShouldMatchByPrefix() {
            assertEquals(Set.of(Capabilities.SYSTEM_SUBPROCESS),
                    engine.mapEventToPermissions(GovernedOperations.PROCESS_START, List.of("ls")));
            assertEquals(Set.of(Capabilities.SYSTEM_SUBPROCESS),
                    engine.mapEventToPermissions("process.kill", 42));
        }

        @Test
        @DisplayName("非受控事件返回空集")
        void ungovernedEventShouldYieldEmpty() {
            assertTrue(engine.mapEventToPermissions("time.sleep", 1).isEmpty());
            assertTrue(engine.mapEventToPermissions(null).isEmpty());
        }
    }

    @Nested
    @DisplayName("声明反查")
    class DeclarationTests {

        @Test
        @DisplayName("声明映射到唯一能力")
        void declarationShouldMapToCapability() {
            assertEquals(Capabilities.FILE_READ_PLUGIN,
                    engine.findDefinitionForDeclaration("file", "read").orElseThrow().getName());
            assertEquals(Capabilities.NETWORK_HTTPS,
                    engine.findDefinitionForDeclaration("network", "outbound:https").orElseThrow().getName());
            assertEquals(Capabilities.SYSTEM_SUBPROCESS,
                    engine.findDefinitionForDeclaration("system", "subprocess").orElseThrow().getName());
        }

        @Test
        @DisplayName("未知声明无法映射")
        void unknownDeclarationShouldNotMap() {
            assertTrue(engine.findDefinitionForDeclaration("file", "execute").isEmpty());
            assertTrue(engine.findDefinitionForDeclaration("gpu", "cuda").isEmpty());
            assertTrue(engine.findDefinitionForDeclaration(null, "read").isEmpty());
        }
    }

    @Nested
    @DisplayName("通配符")
    class GlobTests {

        @Test
        @DisplayName("星号可跨越斜杠")
        void starShouldCrossSlashes() {
            assertTrue(GlobMatcher.matches("outbound/https/api", "outbound*"));
            assertTrue(GlobMatcher.matches("data/a/b.txt", "data/*.txt"));
        }

        @Test
        @DisplayName("问号与字符集")
        void questionMarkAndCharacterClass() {
            assertTrue(GlobMatcher.matches("v1", "v?"));
            assertTrue(GlobMatcher.matches("b", "[abc]"));
            assertFalse(GlobMatcher.matches("d", "[abc]"));
            assertTrue(GlobMatcher.matches("d", "[!abc]"));
        }

        @Test
        @DisplayName("字符集中的方括号与脱字符按字面量处理")
        void bracketsInsideClassShouldBeLiteral() {
            assertTrue(GlobMatcher.matches("[", "[[]"));
            assertTrue(GlobMatcher.matches("^", "[^]"));
            assertTrue(GlobMatcher.matches("]a", "[]]*"));
            assertTrue(GlobMatcher.matches("m", "[a-z]"));
            assertTrue(GlobMatcher.matches("-", "[a-]"));
            assertTrue(GlobMatcher.matches("[x", "[x"));
        }

        @Test
        @DisplayName("无法编译的通配符在注册时报配置错误")
        void malformedGlobShouldFailRegistration() {
            PermissionEngine fresh = new PermissionEngine();
            CapabilityDefinition reversed = CapabilityDefinition.builder()
                    .name("file.read.reversed")
                    .type("file")
                    .resourcePattern("[z-a]")
                    .build();

            assertThrows(ConfigurationException.class, () -> fresh.register(reversed));
            assertTrue(fresh.getDefinition("file.read.reversed").isEmpty());
        }

        @Test
        @DisplayName("空值不匹配")
        void nullShouldNotMatch() {
            assertFalse(GlobMatcher.matches(null, "*"));
        }
    }
}
