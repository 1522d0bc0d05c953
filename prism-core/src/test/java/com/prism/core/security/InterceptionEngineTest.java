package com.prism.core.security;

import com.prism.api.exception.PermissionDeniedException;
import com.prism.api.sandbox.AuditHooks;
import com.prism.api.sandbox.Governed;
import com.prism.api.sandbox.GovernedOperations;
import com.prism.core.config.PrismConfig;
import com.prism.core.support.PluginFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InterceptionEngine 单元测试")
class InterceptionEngineTest {

    private static final String PLUGIN = "p";

    @TempDir
    Path projectRoot;

    private PrismConfig config;
    private DefaultCapabilityLedger ledger;
    private InterceptionEngine interception;
    private Path pluginRoot;

    @BeforeEach
    void setUp() throws Exception {
        config = PluginFixtures.config(projectRoot);
        PermissionEngine engine = PermissionEngine.withDefaults();
        ledger = new DefaultCapabilityLedger(engine);
        interception = new InterceptionEngine(engine, ledger, config);
        pluginRoot = Files.createDirectories(config.pluginHomePath().resolve(PLUGIN));
        interception.registerPluginPaths(PLUGIN, pluginRoot);
    }

    @AfterEach
    void tearDown() {
        interception.deactivate();
    }

    private void grant(String... entries) {
        LockFile lock = new LockFile();
        List<LockFile.LockedPermission> permissions = new ArrayList<>();
        for (String entry : entries) {
            int colon = entry.indexOf(':');
            permissions.add(new LockFile.LockedPermission(entry.substring(0, colon), entry.substring(colon + 1), null));
        }
        lock.setPermissions(permissions);
        ledger.grantFromLock(PLUGIN, lock);
    }

    private void auditAs(String plugin, String event, Object... args) throws Exception {
        PluginScope.runAs(plugin, () -> interception.audit(event, args));
    }

    @Nested
    @DisplayName("作用域")
    class ScopeTests {

        @Test
        @DisplayName("不在插件作用域内时不做任何检查")
        void noScopeShouldBeNoOp() {
            Path secret = config.secureDirectoryPath().resolve("keys.bin");
            assertDoesNotThrow(() -> interception.audit(GovernedOperations.FILE_OPEN, secret, "r"));
            assertTrue(ledger.getViolations(PLUGIN).isEmpty());
        }

        @Test
        @DisplayName("非受控事件直接放行")
        void ungovernedEventShouldPass() {
            assertDoesNotThrow(() -> auditAs(PLUGIN, "time.sleep", 1));
        }
    }

    @Nested
    @DisplayName("固定围墙")
    class FixedJailTests {

        @Test
        @DisplayName("即使拥有读能力也不能访问安全目录")
        void secureDirectoryShouldBeDeniedRegardlessOfGrants() {
            grant("file:read");
            Path secret = config.secureDirectoryPath().resolve("master.key");

            PermissionDeniedException ex = assertThrows(PermissionDeniedException.class,
                    () -> auditAs(PLUGIN, GovernedOperations.FILE_OPEN, secret, "r"));

            assertEquals(PLUGIN, ex.getPluginName());
            assertTrue(ex.getMessage().contains("system secure directory"));
            assertEquals(1, ledger.getViolations(PLUGIN).size());
        }

        @Test
        @DisplayName("不能读取自己的锁文件")
        void ownLockFileShouldBeDenied() {
            grant("file:read");
            Path lock = LockFile.locate(pluginRoot);

            PermissionDeniedException ex = assertThrows(PermissionDeniedException.class,
                    () -> auditAs(PLUGIN, GovernedOperations.FILE_OPEN, lock, "r"));
            assertTrue(ex.getMessage().contains("its own lock file"));
        }

        @Test
        @DisplayName("不能重命名或删除任何锁文件")
        void lockFileMutationShouldBeDenied() {
            grant("file:read", "file:write", "system:subprocess");
            Path foreignLock = config.pluginHomePath().resolve("other").resolve(LockFile.FILE_NAME);

            assertThrows(PermissionDeniedException.class,
                    () -> auditAs(PLUGIN, GovernedOperations.FILE_DELETE, foreignLock));
            assertThrows(PermissionDeniedException.class,
                    () -> auditAs(PLUGIN, GovernedOperations.FILE_RENAME, pluginRoot.resolve("x.json"), foreignLock));
        }
    }

    @Nested
    @DisplayName("目录围墙")
    class DirectoryJailTests {

        @Test
        @DisplayName("插件目录内的读取在授权后放行")
        void readInsideRootShouldPass() {
            grant("file:read");
            assertDoesNotThrow(() -> auditAs(PLUGIN, GovernedOperations.FILE_OPEN, pluginRoot.resolve("data.txt"), "r"));
        }

        @Test
        @DisplayName("插件临时目录与根目录同等对待")
        void tempDirectoryShouldPass() {
            grant("file:write");
            Path temp = config.tempDataPath().resolve(PLUGIN).resolve("cache.bin");
            assertDoesNotThrow(() -> auditAs(PLUGIN, GovernedOperations.FILE_OPEN, temp, "w"));
        }

        @Test
        @DisplayName("插件目录外的访问被拒绝")
        void outsideRootShouldBeDenied() {
            grant("file:read");
            Path outside = projectRoot.resolve("elsewhere.txt");

            PermissionDeniedException ex = assertThrows(PermissionDeniedException.class,
                    () -> auditAs(PLUGIN, GovernedOperations.FILE_OPEN, outside, "r"));
            assertTrue(ex.getMessage().contains("outside its allowed directories"));
        }

        @Test
        @DisplayName("拥有 system. 前缀能力的插件可越过目录围墙")
        void privilegedPluginShouldBypassDirectoryJail() {
            grant("file:read", "system:subprocess");
            Path outside = projectRoot.resolve("elsewhere.txt");
            assertDoesNotThrow(() -> auditAs(PLUGIN, GovernedOperations.FILE_OPEN, outside, "r"));
        }

        @Test
        @DisplayName("未注册目录的插件一律拒绝文件访问")
        void unregisteredPluginShouldBeDenied() {
            PermissionDeniedException ex = assertThrows(PermissionDeniedException.class,
                    () -> auditAs("ghost", GovernedOperations.FILE_OPEN, pluginRoot.resolve("a.txt"), "r"));
            assertTrue(ex.getMessage().contains("root path not registered"));
        }

        @Test
        @DisplayName("无法解析的路径被拒绝")
        void unresolvablePathShouldBeDenied() {
            grant("file:read");
            assertThrows(PermissionDeniedException.class,
                    () -> interception.enforceDirectoryJail(PLUGIN, GovernedOperations.FILE_OPEN, "bad\0path"));
        }
    }

    @Nested
    @DisplayName("能力检查")
    class CapabilityTests {

        @Test
        @DisplayName("缺少写能力时写入被拒绝并记录违规")
        void writeWithoutGrantShouldBeDenied() {
            grant("file:read");
            Path target = pluginRoot.resolve("out.txt");

            PermissionDeniedException ex = assertThrows(PermissionDeniedException.class,
                    () -> auditAs(PLUGIN, GovernedOperations.FILE_OPEN, target, "w"));

            assertTrue(ex.getMessage().startsWith("Plugin 'p' blocked from performing unauthorized action. Event: file.open"));
            assertTrue(ex.getMessage().contains("Required one of Permissions: [file.write.plugin]"));
            assertEquals(List.of(ex.getMessage()), ledger.getViolations(PLUGIN));
        }

        @Test
        @DisplayName("HTTPS 连接需要 network.https")
        void httpsConnectShouldRequireGrant() {
            assertThrows(PermissionDeniedException.class,
                    () -> auditAs(PLUGIN, GovernedOperations.SOCKET_CONNECT, "api.example.com", 443));

            grant("network:outbound:https");
            assertDoesNotThrow(() -> auditAs(PLUGIN, GovernedOperations.SOCKET_CONNECT, "api.example.com", 443));
            assertThrows(PermissionDeniedException.class,
                    () -> auditAs(PLUGIN, GovernedOperations.SOCKET_CONNECT, "api.example.com", 80));
        }

        @Test
        @DisplayName("其他端口不受能力约束")
        void unmappedPortShouldPass() {
            assertDoesNotThrow(() -> auditAs(PLUGIN, GovernedOperations.SOCKET_CONNECT, "db.local", 5432));
        }

        @Test
        @DisplayName("启动子进程需要 system.subprocess")
        void processStartShouldRequireGrant() {
            assertThrows(PermissionDeniedException.class,
                    () -> auditAs(PLUGIN, GovernedOperations.PROCESS_START, List.of("ls")));
            grant("system:subprocess");
            assertDoesNotThrow(() -> auditAs(PLUGIN, GovernedOperations.PROCESS_START, List.of("ls")));
        }
    }

    @Nested
    @DisplayName("安装为审计钩子")
    class HookTests {

        @Test
        @DisplayName("激活后受控操作经由钩子被拦截")
        void activatedEngineShouldGuardGovernedOperations() throws Exception {
            interception.activate();
            assertTrue(interception.isActive());
            assertTrue(AuditHooks.isInstalled());

            Path secret = config.secureDirectoryPath().resolve("token.txt");
            Files.createDirectories(secret.getParent());
            Files.writeString(secret, "top-secret");
            grant("file:read");

            assertThrows(PermissionDeniedException.class,
                    () -> PluginScope.callAs(PLUGIN, () -> Governed.readString(secret)));
            // 宿主自身不受限制
            assertEquals("top-secret", Governed.readString(secret));
        }

        @Test
        @DisplayName("停用后卸载钩子")
        void deactivateShouldUninstallHook() {
            interception.activate();
            interception.deactivate();
            assertFalse(interception.isActive());
            assertFalse(AuditHooks.isInstalled());
        }
    }
}
