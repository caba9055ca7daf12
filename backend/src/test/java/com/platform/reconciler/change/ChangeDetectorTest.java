package com.platform.reconciler.change;

import com.platform.reconciler.model.DesktopConfig;
import com.platform.reconciler.model.PackageSpec;
import com.platform.reconciler.model.RepositorySpec;
import com.platform.reconciler.model.ServiceSpec;
import com.platform.reconciler.model.SystemConfiguration;
import com.platform.reconciler.model.SystemSettings;
import com.platform.reconciler.model.UserSpec;
import com.platform.reconciler.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ChangeDetectorTest {

    private ChangeDetector detector;

    @BeforeEach
    void setUp() {
        detector = new ChangeDetector(TestFixtures.policy());
    }

    @Test
    void identicalConfigurationsProduceNoChanges() {
        SystemConfiguration config = SystemConfiguration.builder()
            .packages(List.of(PackageSpec.install("vim")))
            .services(List.of(ServiceSpec.enabled("sshd")))
            .users(List.of(UserSpec.builder().name("alice").build()))
            .build();

        assertThat(detector.detectChanges(config, config)).isEmpty();
    }

    @Test
    void everySystemSettingIsCompared() {
        SystemConfiguration current = SystemConfiguration.empty();
        SystemConfiguration desired = SystemConfiguration.builder()
            .system(new SystemSettings("workstation", "Europe/Berlin", "de_DE.UTF-8"))
            .build();

        List<ConfigChange> changes = detector.detectChanges(current, desired);

        assertThat(changes).extracting(ConfigChange::field).containsExactly("hostname", "timezone", "locale");
        assertThat(changes).allMatch(c -> c.type() == ChangeType.SYSTEM_CONFIG);
        assertThat(changes.get(0).description()).isEqualTo("Hostname change: horizonos → workstation");
        assertThat(changes.get(2).impactLevel()).isEqualTo(ImpactLevel.MEDIUM);
    }

    @Nested
    class Packages {

        @Test
        void installAndRemoveAreGroupedIntoOneChangeEach() {
            SystemConfiguration current = SystemConfiguration.builder()
                .packages(List.of(PackageSpec.install("vim"), PackageSpec.install("nano")))
                .build();
            SystemConfiguration desired = SystemConfiguration.builder()
                .packages(List.of(PackageSpec.install("vim"), PackageSpec.install("git"), PackageSpec.install("htop")))
                .build();

            List<ConfigChange> changes = detector.detectChanges(current, desired);

            assertThat(changes).extracting(ConfigChange::type)
                .containsExactly(ChangeType.PACKAGE_INSTALL, ChangeType.PACKAGE_REMOVE);
            assertThat(changes.get(0).newValues(PackageSpec.class)).extracting(PackageSpec::name)
                .containsExactly("git", "htop");
            assertThat(changes.get(0).description()).isEqualTo("Install packages: git, htop");
            assertThat(changes.get(1).oldValues(PackageSpec.class)).extracting(PackageSpec::name)
                .containsExactly("nano");
        }

        @Test
        void explicitRemoveIntentTriggersRemoval() {
            SystemConfiguration current = SystemConfiguration.builder()
                .packages(List.of(PackageSpec.install("firefox")))
                .build();
            SystemConfiguration desired = SystemConfiguration.builder()
                .packages(List.of(PackageSpec.remove("firefox")))
                .build();

            List<ConfigChange> changes = detector.detectChanges(current, desired);

            assertThat(changes).singleElement()
                .satisfies(c -> assertThat(c.type()).isEqualTo(ChangeType.PACKAGE_REMOVE));
        }
    }

    @Nested
    class Services {

        @Test
        void stateAndConfigChangesAreReportedSeparately() {
            SystemConfiguration current = SystemConfiguration.builder()
                .services(List.of(ServiceSpec.disabled("nginx")))
                .build();
            SystemConfiguration desired = SystemConfiguration.builder()
                .services(List.of(new ServiceSpec("nginx", true, Map.of("worker_processes", "4"))))
                .build();

            List<ConfigChange> changes = detector.detectChanges(current, desired);

            assertThat(changes).extracting(ConfigChange::type)
                .containsExactly(ChangeType.SERVICE_STATE, ChangeType.SERVICE_CONFIG);
            assertThat(changes).allMatch(c -> "nginx".equals(c.affectedService()));
            assertThat(changes.get(0).description()).isEqualTo("Service nginx: enable");
            assertThat(changes.get(1).updateStrategy()).isEqualTo(UpdateStrategy.SERVICE_RELOAD);
        }

        @Test
        void configChangeOnUnknownServiceRequiresReboot() {
            SystemConfiguration current = SystemConfiguration.builder()
                .services(List.of(ServiceSpec.enabled("docker")))
                .build();
            SystemConfiguration desired = SystemConfiguration.builder()
                .services(List.of(new ServiceSpec("docker", true, Map.of("storage-driver", "overlay2"))))
                .build();

            assertThat(detector.detectChanges(current, desired)).singleElement()
                .satisfies(c -> assertThat(c.updateStrategy()).isEqualTo(UpdateStrategy.REBOOT_REQUIRED));
        }

        @Test
        void addAndRemoveCarryTheServiceName() {
            SystemConfiguration current = SystemConfiguration.builder()
                .services(List.of(ServiceSpec.enabled("cups")))
                .build();
            SystemConfiguration desired = SystemConfiguration.builder()
                .services(List.of(ServiceSpec.enabled("sshd")))
                .build();

            List<ConfigChange> changes = detector.detectChanges(current, desired);

            assertThat(changes).extracting(ConfigChange::description)
                .containsExactly("Add service: sshd (enabled)", "Remove service: cups");
        }
    }

    @Nested
    class Users {

        @Test
        void modificationListsEveryChangedAttribute() {
            UserSpec before = UserSpec.builder().name("alice").groups(List.of("users")).build();
            UserSpec after = before.toBuilder().groups(List.of("users", "wheel")).build();

            List<ConfigChange> changes = detector.detectChanges(
                SystemConfiguration.builder().users(List.of(before)).build(),
                SystemConfiguration.builder().users(List.of(after)).build());

            assertThat(changes).singleElement().satisfies(change -> {
                assertThat(change.type()).isEqualTo(ChangeType.USER_MODIFY);
                assertThat(change.description()).isEqualTo("Modify user alice: groups");
                assertThat(change.oldValueAs(UserSpec.class)).isEqualTo(before);
                assertThat(change.newValueAs(UserSpec.class)).isEqualTo(after);
            });
        }

        @Test
        void removalIsCriticalAndRequiresReboot() {
            SystemConfiguration current = SystemConfiguration.builder()
                .users(List.of(UserSpec.builder().name("bob").build()))
                .build();

            List<ConfigChange> changes = detector.detectChanges(current, SystemConfiguration.empty());

            assertThat(changes).singleElement().satisfies(change -> {
                assertThat(change.type()).isEqualTo(ChangeType.USER_REMOVE);
                assertThat(change.impactLevel()).isEqualTo(ImpactLevel.CRITICAL);
                assertThat(change.updateStrategy()).isEqualTo(UpdateStrategy.REBOOT_REQUIRED);
            });
        }
    }

    @Test
    void repositoryOrderDoesNotMatter() {
        RepositorySpec core = RepositorySpec.builder().name("core").url("https://mirror.example/core").build();
        RepositorySpec extra = RepositorySpec.builder().name("extra").url("https://mirror.example/extra").build();

        List<ConfigChange> changes = detector.detectChanges(
            SystemConfiguration.builder().repositories(List.of(core, extra)).build(),
            SystemConfiguration.builder().repositories(List.of(extra, core)).build());

        assertThat(changes).isEmpty();
    }

    @Test
    void enablingDesktopRequiresReboot() {
        DesktopConfig desktop = DesktopConfig.builder().environment("plasma").build();

        List<ConfigChange> changes = detector.detectChanges(
            SystemConfiguration.empty(),
            SystemConfiguration.builder().desktop(desktop).build());

        assertThat(changes).singleElement().satisfies(change -> {
            assertThat(change.type()).isEqualTo(ChangeType.DESKTOP_CONFIG);
            assertThat(change.description()).isEqualTo("Enable desktop environment: plasma");
            assertThat(change.updateStrategy()).isEqualTo(UpdateStrategy.REBOOT_REQUIRED);
        });
    }

    @Test
    void swappingSidesMirrorsTheChanges() {
        SystemConfiguration a = SystemConfiguration.builder()
            .packages(List.of(PackageSpec.install("vim")))
            .services(List.of(ServiceSpec.enabled("sshd")))
            .build();
        SystemConfiguration b = SystemConfiguration.builder()
            .packages(List.of(PackageSpec.install("emacs")))
            .build();

        List<ChangeType> forward = detector.detectChanges(a, b).stream().map(ConfigChange::type).toList();
        List<ChangeType> backward = detector.detectChanges(b, a).stream().map(ConfigChange::type).toList();

        assertThat(forward).containsExactly(
            ChangeType.PACKAGE_INSTALL, ChangeType.PACKAGE_REMOVE, ChangeType.SERVICE_REMOVE);
        assertThat(backward).containsExactly(
            ChangeType.PACKAGE_INSTALL, ChangeType.PACKAGE_REMOVE, ChangeType.SERVICE_ADD);
    }
}
