package com.landfall.deploy;

import com.landfall.core.metrics.LandfallMetrics;
import com.landfall.core.model.ClusterHandle;
import com.landfall.manifest.KubernetesManifest;
import com.landfall.manifest.ManifestPackager;
import com.landfall.manifest.ManifestSerializationException;
import com.landfall.core.model.ResourceObject;
import com.landfall.output.CommandOutputWriter;
import com.landfall.runcommand.CancellationToken;
import com.landfall.runcommand.CommandDispatcher;
import com.landfall.runcommand.CommandFailedException;
import com.landfall.runcommand.CommandRejectedException;
import com.landfall.runcommand.CommandRunner;
import com.landfall.runcommand.OperationCancelledException;
import com.landfall.runcommand.OperationPoller;
import com.landfall.runcommand.OperationStatus;
import com.landfall.runcommand.ScriptedCommandChannel;
import com.landfall.stability.StabilityChecker;
import com.landfall.stability.StabilityClassifier;
import com.landfall.stability.StabilityCoordinator;
import com.landfall.stability.StabilityProperties;
import com.landfall.stability.UnstableResourceException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

import java.io.ByteArrayInputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Set;
import java.util.zip.ZipInputStream;

import static org.junit.jupiter.api.Assertions.*;

class ClusterDeployerTest {

    private static final ClusterHandle CLUSTER = ClusterHandle.of("sub-1", "rg-prod", "aks-east");

    @TempDir
    Path outputDir;

    private ScriptedCommandChannel channel;
    private SimpleMeterRegistry registry;
    private ClusterDeployer deployer;

    @BeforeEach
    void setUp() {
        channel = new ScriptedCommandChannel();
        registry = new SimpleMeterRegistry();
        var metrics = new LandfallMetrics(registry);
        var runner = new CommandRunner(new CommandDispatcher(channel),
                new OperationPoller(channel, Duration.ofMillis(1), Duration.ZERO, Duration.ofMillis(5)),
                new CommandOutputWriter(outputDir), metrics);
        var properties = new StabilityProperties();
        var checker = new StabilityChecker(runner, StabilityClassifier.defaults(), properties, metrics);
        deployer = new ClusterDeployer(new ManifestPackager(), runner, new StabilityCoordinator(checker, properties), metrics);
    }

    @Nested
    @DisplayName("deploy")
    class Deploy {

        @Test
        @DisplayName("applies the archive then checks each workload and pod")
        void deploymentAndPod() throws Exception {
            deployer.deploy(CLUSTER, List.of(
                    KubernetesManifest.of("apps/v1", "Deployment", "web", "prod"),
                    KubernetesManifest.of("v1", "Pod", "debug", "")));

            var commands = channel.commands();
            assertEquals("kubectl apply -f manifests/", commands.get(0));
            assertEquals(List.of("manifests/0.json", "manifests/1.json"), entryNames(channel.submitted().get(0).contextPayload()));
            assertEquals(Set.of(
                    "kubectl rollout status Deployment/web -n prod",
                    "kubectl wait --for=condition=Ready pod/debug -n default"), Set.copyOf(commands.subList(1, 3)));
            assertEquals(3, commands.size());
            assertEquals(1.0, registry.find("landfall.operations.total")
                    .tag("operation", "deploy").tag("result", "success").counter().count());
        }

        @Test
        @DisplayName("a job that never completes fails the deploy naming the job")
        void jobNeverCompletes() {
            channel.respond("kubectl wait --for=condition=complete",
                    OperationStatus.failed("error: timed out waiting for the condition on jobs/migrate", 1));

            var e = assertThrows(DeploymentException.class, () -> deployer.deploy(CLUSTER,
                    List.of(KubernetesManifest.of("batch/v1", "Job", "migrate", "batch"))));

            assertEquals(DeployStep.CHECKING_STABILITY, e.getFailedStep());
            assertEquals(DeployOperation.DEPLOY, e.getOperation());
            var unstable = assertInstanceOf(UnstableResourceException.class, e.getCause());
            assertEquals("Job", unstable.getKind());
            assertEquals("migrate", unstable.getName());
            assertEquals("batch", unstable.getNamespace());
            assertInstanceOf(CommandFailedException.class, unstable.getCause());
            assertFalse(e.isCancelled());
            assertEquals(List.of(
                    "kubectl apply -f manifests/",
                    "kubectl logs --pod-running-timeout=20s --follow job/migrate -n batch",
                    "kubectl wait --for=condition=complete --timeout=10s job/migrate -n batch"), channel.commands());
        }

        @Test
        @DisplayName("an empty list applies an empty archive and succeeds")
        void emptyList() throws Exception {
            deployer.deploy(CLUSTER, List.of());

            assertEquals(List.of("kubectl apply -f manifests/"), channel.commands());
            assertTrue(entryNames(channel.submitted().get(0).contextPayload()).isEmpty());
        }

        @Test
        @DisplayName("a rejected apply runs no stability checks")
        void applyRejected() {
            channel.reject("kubectl apply", new CommandRejectedException("quota exceeded", 409));

            var e = assertThrows(DeploymentException.class, () -> deployer.deploy(CLUSTER,
                    List.of(KubernetesManifest.of("apps/v1", "Deployment", "web", "prod"))));

            assertEquals(DeployStep.SUBMITTING, e.getFailedStep());
            assertEquals(List.of("kubectl apply -f manifests/"), channel.commands());
        }

        @Test
        @DisplayName("a failing apply runs no stability checks")
        void applyFails() {
            channel.respond("kubectl apply", OperationStatus.failed("error: unable to recognize", 1));

            var e = assertThrows(DeploymentException.class, () -> deployer.deploy(CLUSTER,
                    List.of(KubernetesManifest.of("apps/v1", "Deployment", "web", "prod"))));

            assertEquals(DeployStep.AWAITING_COMPLETION, e.getFailedStep());
            assertEquals(1, channel.commands().size());
            assertEquals(1.0, registry.find("landfall.operations.total")
                    .tag("result", "failure").tag("step", "AWAITING_COMPLETION").counter().count());
        }

        @Test
        @DisplayName("an unserializable object fails before anything is submitted")
        void serializationFailure() {
            ResourceObject broken = new ResourceObject() {
                @Override public String kind() { return "Widget"; }
                @Override public String name() { return "w"; }
                @Override public String namespace() { return ""; }
                @Override public Object body() { return new Object(); }
            };

            var e = assertThrows(DeploymentException.class, () -> deployer.deploy(CLUSTER, List.of(broken)));

            assertEquals(DeployStep.PACKAGING, e.getFailedStep());
            assertInstanceOf(ManifestSerializationException.class, e.getCause());
            assertTrue(channel.commands().isEmpty());
        }

        @Test
        @DisplayName("only the first of several unstable objects is reported")
        void firstFailureWins() {
            channel.respond("kubectl rollout status Deployment/a", OperationStatus.failed("", 1));
            channel.respond("kubectl rollout status Deployment/b", OperationStatus.failed("", 1));

            var e = assertThrows(DeploymentException.class, () -> deployer.deploy(CLUSTER, List.of(
                    KubernetesManifest.of("apps/v1", "Deployment", "a", "prod"),
                    KubernetesManifest.of("apps/v1", "Deployment", "b", "prod"),
                    KubernetesManifest.of("apps/v1", "Deployment", "c", "prod"))));

            var unstable = (UnstableResourceException) e.getCause();
            assertTrue(Set.of("a", "b").contains(unstable.getName()));
            assertEquals(1, unstable.getAdditionalFailures());
        }

        @Test
        @DisplayName("cancellation is reported as such")
        void cancelled() {
            channel.hang("kubectl apply");
            var token = CancellationToken.withTimeout(Duration.ofMillis(50));

            var e = assertThrows(DeploymentException.class, () -> deployer.deploy(CLUSTER,
                    List.of(KubernetesManifest.of("apps/v1", "Deployment", "web", "prod")), token));

            assertTrue(e.isCancelled());
            assertInstanceOf(OperationCancelledException.class, e.getCause());
            assertEquals(DeployStep.AWAITING_COMPLETION, e.getFailedStep());
        }

        @Test
        @DisplayName("an already cancelled deploy submits nothing to the cluster")
        void cancelledBeforeSubmit() {
            var token = CancellationToken.create();
            token.cancel();

            var e = assertThrows(DeploymentException.class, () -> deployer.deploy(CLUSTER,
                    List.of(KubernetesManifest.of("apps/v1", "Deployment", "web", "prod")), token));

            assertTrue(e.isCancelled());
            assertEquals(DeployStep.SUBMITTING, e.getFailedStep());
            assertTrue(channel.commands().isEmpty());
        }
    }

    @Nested
    @DisplayName("clean")
    class Clean {

        @Test
        @DisplayName("submits only the delete command and never checks stability")
        void deleteOnly() throws Exception {
            deployer.clean(CLUSTER, List.of(
                    KubernetesManifest.of("apps/v1", "Deployment", "web", "prod"),
                    KubernetesManifest.of("batch/v1", "Job", "migrate", "batch")));

            assertEquals(List.of("kubectl delete -f manifests/"), channel.commands());
            assertEquals(2, entryNames(channel.submitted().get(0).contextPayload()).size());
        }

        @Test
        @DisplayName("a failing delete is reported")
        void deleteFails() {
            channel.respond("kubectl delete", OperationStatus.failed("error: forbidden", 1));

            var e = assertThrows(DeploymentException.class, () -> deployer.clean(CLUSTER,
                    List.of(KubernetesManifest.of("apps/v1", "Deployment", "web", "prod"))));

            assertEquals(DeployOperation.CLEAN, e.getOperation());
            assertEquals(DeployStep.AWAITING_COMPLETION, e.getFailedStep());
        }
    }

    @Test
    @DisplayName("operation MDC keys are cleared afterwards")
    void clearsMdc() {
        deployer.deploy(CLUSTER, List.of());

        assertNull(MDC.get("cluster"));
        assertNull(MDC.get("operation"));
    }

    private static List<String> entryNames(String base64) throws Exception {
        var names = new ArrayList<String>();
        try (var zip = new ZipInputStream(new ByteArrayInputStream(Base64.getDecoder().decode(base64)))) {
            for (var entry = zip.getNextEntry(); entry != null; entry = zip.getNextEntry()) {
                names.add(entry.getName());
            }
        }
        return names;
    }
}
