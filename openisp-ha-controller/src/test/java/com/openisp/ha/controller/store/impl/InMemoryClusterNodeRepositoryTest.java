package com.openisp.ha.controller.store.impl;

import com.openisp.ha.model.ClusterNode;
import com.openisp.ha.model.NodeStatus;
import com.openisp.ha.model.ServerRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryClusterNodeRepositoryTest {

    private InMemoryClusterNodeRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryClusterNodeRepository();
    }

    private ClusterNode row(String cluster, String hw, String ip, ServerRole role) {
        return ClusterNode.builder()
                .clusterId(cluster)
                .hardwareId(hw)
                .serverIp(ip)
                .serverRole(role)
                .status(NodeStatus.ONLINE)
                .build();
    }

    @Test
    @DisplayName("should assign ids and list rows of one cluster in id order")
    void shouldAssignIds() {
        // Given
        ClusterNode main = repository.save(row("c1", "hw-1", "10.0.0.1", ServerRole.MAIN)).block();
        ClusterNode secondary = repository.save(row("c1", "hw-2", "10.0.0.2", ServerRole.SECONDARY)).block();
        repository.save(row("c2", "hw-9", "10.0.9.1", ServerRole.MAIN)).block();

        // When
        List<ClusterNode> rows = repository.findByClusterId("c1").collectList().block();

        // Then
        assertThat(main.getId()).isEqualTo(1L);
        assertThat(secondary.getId()).isEqualTo(2L);
        assertThat(rows).extracting(ClusterNode::getHardwareId).containsExactly("hw-1", "hw-2");
    }

    @Test
    @DisplayName("should update every row with a matching address")
    void shouldUpdateStatusByAddress() {
        repository.save(row("c1", "hw-1", "10.0.0.1", ServerRole.MAIN)).block();
        repository.save(row("c1", "hw-2", "10.0.0.2", ServerRole.SECONDARY)).block();

        StepVerifier.create(repository.updateStatusByServerIp("10.0.0.1", NodeStatus.OFFLINE))
                .expectNext(1)
                .verifyComplete();

        assertThat(repository.findByHardwareId("hw-1").block()).get()
                .extracting(ClusterNode::getStatus).isEqualTo(NodeStatus.OFFLINE);
        assertThat(repository.findByHardwareId("hw-2").block()).get()
                .extracting(ClusterNode::getStatus).isEqualTo(NodeStatus.ONLINE);
    }

    @Test
    @DisplayName("should change role and status by hardware id")
    void shouldUpdateRoleByHardwareId() {
        repository.save(row("c1", "hw-2", "10.0.0.2", ServerRole.SECONDARY)).block();

        assertThat(repository.updateRoleAndStatusByHardwareId("hw-2", ServerRole.MAIN, NodeStatus.ONLINE).block()).isTrue();
        assertThat(repository.updateRoleAndStatusByHardwareId("hw-x", ServerRole.MAIN, NodeStatus.ONLINE).block()).isFalse();
        assertThat(repository.findByHardwareId("hw-2").block().orElseThrow().getServerRole()).isEqualTo(ServerRole.MAIN);
    }

    @Test
    @DisplayName("should delete single rows and whole clusters")
    void shouldDelete() {
        ClusterNode first = repository.save(row("c1", "hw-1", "10.0.0.1", ServerRole.MAIN)).block();
        repository.save(row("c1", "hw-2", "10.0.0.2", ServerRole.SECONDARY)).block();
        repository.save(row("c1", "hw-3", "10.0.0.3", ServerRole.SERVER3)).block();

        assertThat(repository.deleteById(first.getId()).block()).isTrue();
        assertThat(repository.deleteById(first.getId()).block()).isFalse();
        assertThat(repository.deleteByHardwareId("hw-2").block()).isTrue();
        assertThat(repository.deleteByClusterId("c1").block()).isEqualTo(1);
        assertThat(repository.findByClusterId("c1").collectList().block()).isEmpty();
    }

    @Test
    @DisplayName("should keep explicit ids and continue numbering after them")
    void shouldKeepExplicitIds() {
        repository.save(row("c1", "hw-1", "10.0.0.1", ServerRole.MAIN).withId(7)).block();

        ClusterNode next = repository.save(row("c1", "hw-2", "10.0.0.2", ServerRole.SECONDARY)).block();

        assertThat(next.getId()).isEqualTo(8L);
    }
}
