package com.topdeck.riskgraph.service.graph;

import com.topdeck.riskgraph.dto.graph.DependencyEdge;
import com.topdeck.riskgraph.dto.graph.RelationshipKind;
import com.topdeck.riskgraph.dto.graph.Resource;
import com.topdeck.riskgraph.exception.GraphAccessException;
import com.topdeck.riskgraph.exception.InvalidConfigurationException;
import com.topdeck.riskgraph.exception.ResourceNotFoundException;
import com.topdeck.riskgraph.model.graph.nodes.ResourceNode;
import com.topdeck.riskgraph.repository.graph.ResourceNodeRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.neo4j.driver.Record;
import org.neo4j.driver.Values;
import org.neo4j.driver.types.TypeSystem;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.data.neo4j.core.Neo4jClient;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class Neo4jGraphAccessorTest {

    @Mock
    private ResourceNodeRepository resourceNodeRepository;

    @Mock
    private Neo4jClient neo4jClient;

    @InjectMocks
    private Neo4jGraphAccessor graphAccessor;

    @Test
    void getNode_mapsDiscoverySignalsToAttributes() {
        ResourceNode node = ResourceNode.builder()
                .id("sql-1")
                .resourceType("sql_database")
                .cloudProvider("azure")
                .region("westeurope")
                .backupEnabled(false)
                .secretRotationEnabled(true)
                .build();
        when(resourceNodeRepository.findById("sql-1")).thenReturn(Optional.of(node));

        Resource resource = graphAccessor.getNode("sql-1");

        assertThat(resource.getName()).isEqualTo("sql-1");
        assertThat(resource.getResourceType()).isEqualTo("sql_database");
        assertThat(resource.flag(Resource.BACKUP_ENABLED)).contains(false);
        assertThat(resource.flag(Resource.SECRET_ROTATION_ENABLED)).contains(true);
        assertThat(resource.attribute(Resource.NETWORK_SECURITY_GROUP)).isEmpty();
    }

    @Test
    void getNode_throwsNotFound_whenNodeIsMissing() {
        when(resourceNodeRepository.findById("ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> graphAccessor.getNode("ghost"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void getNode_translatesStoreFailure() {
        DataAccessResourceFailureException failure = new DataAccessResourceFailureException("connection refused");
        when(resourceNodeRepository.findById("sql-1")).thenThrow(failure);

        assertThatThrownBy(() -> graphAccessor.getNode("sql-1"))
                .isInstanceOf(GraphAccessException.class)
                .hasCause(failure);
    }

    @Test
    void getOutgoingEdges_throwsNotFound_withoutQueryingEdges() {
        when(resourceNodeRepository.existsById("ghost")).thenReturn(false);

        assertThatThrownBy(() -> graphAccessor.getOutgoingEdges("ghost"))
                .isInstanceOf(ResourceNotFoundException.class);
        verifyNoInteractions(neo4jClient);
    }

    @Test
    void getIncomingEdges_translatesQueryFailure() {
        when(resourceNodeRepository.existsById("sql-1")).thenReturn(true);
        when(neo4jClient.query(anyString())).thenThrow(new TransientDataAccessResourceException("timed out"));

        assertThatThrownBy(() -> graphAccessor.getIncomingEdges("sql-1"))
                .isInstanceOf(GraphAccessException.class)
                .hasMessageContaining("incoming edges of sql-1");
    }

    @Test
    void findResourceIdsWithDependents_returnsRepositoryOrder() {
        when(resourceNodeRepository.findAllWithDependents()).thenReturn(List.of(
                ResourceNode.builder().id("a").build(),
                ResourceNode.builder().id("b").build()));

        assertThat(graphAccessor.findResourceIdsWithDependents()).containsExactly("a", "b");
    }

    @Test
    void getIncomingEdges_mapsUnknownTypeToOther() {
        Record record = edgeRecord("api", "sql-1", "WEIRD", "data", Values.value(0.4));
        stubEdgeQuery(record);

        List<DependencyEdge> edges = graphAccessor.getIncomingEdges("sql-1");

        assertThat(edges).hasSize(1);
        DependencyEdge edge = edges.get(0);
        assertThat(edge.getSourceId()).isEqualTo("api");
        assertThat(edge.getRelationshipKind()).isEqualTo(RelationshipKind.OTHER);
        assertThat(edge.getCategory()).isEqualTo("data");
        assertThat(edge.getStrength()).isEqualTo(0.4);
        assertThat(edge.isImpactCarrying()).isFalse();
    }

    @Test
    void getIncomingEdges_kindFilterDropsUnknownTypes() {
        Record record = edgeRecord("api", "sql-1", "WEIRD", "data", Values.value(0.4));
        stubEdgeQuery(record);

        assertThat(graphAccessor.getIncomingEdges("sql-1", RelationshipKind.impactKinds())).isEmpty();
    }

    @Test
    void getOutgoingEdges_defaultsMissingStrengthAndCategory() {
        Record record = edgeRecord("api", "sql-1", "depends_on", null, Values.NULL);
        stubEdgeQuery(record);

        List<DependencyEdge> edges = graphAccessor.getOutgoingEdges("api", Set.of());

        assertThat(edges).hasSize(1);
        assertThat(edges.get(0).getRelationshipKind()).isEqualTo(RelationshipKind.DEPENDS_ON);
        assertThat(edges.get(0).getStrength()).isEqualTo(1.0);
        assertThat(edges.get(0).getCategory()).isEqualTo(DependencyEdge.DEFAULT_CATEGORY);
    }

    @Test
    void getIncomingEdges_reportsMalformedStoredStrength() {
        Record record = edgeRecord("api", "sql-1", "DEPENDS_ON", "data", Values.value(1.5));
        stubEdgeQuery(record);

        assertThatThrownBy(() -> graphAccessor.getIncomingEdges("sql-1"))
                .isInstanceOf(GraphAccessException.class)
                .hasMessageContaining("api -> sql-1")
                .hasCauseInstanceOf(InvalidConfigurationException.class);
    }

    private static Record edgeRecord(String sourceId, String targetId, String type, String category,
                                     org.neo4j.driver.Value strength) {
        Record record = mock(Record.class);
        when(record.get("sourceId")).thenReturn(Values.value(sourceId));
        when(record.get("targetId")).thenReturn(Values.value(targetId));
        when(record.get("type")).thenReturn(Values.value(type));
        when(record.get("category")).thenReturn(category != null ? Values.value(category) : Values.NULL);
        when(record.get("strength")).thenReturn(strength);
        return record;
    }

    /**
     * Stubs the Cypher call chain so the accessor's own row mapping runs against {@code record}.
     */
    @SuppressWarnings("unchecked")
    private void stubEdgeQuery(Record record) {
        Neo4jClient.UnboundRunnableSpec unbound = mock(Neo4jClient.UnboundRunnableSpec.class);
        Neo4jClient.RunnableSpec bound = mock(Neo4jClient.RunnableSpec.class);
        Neo4jClient.MappingSpec<DependencyEdge> mappingSpec = mock(Neo4jClient.MappingSpec.class);
        Neo4jClient.RecordFetchSpec<DependencyEdge> fetchSpec = mock(Neo4jClient.RecordFetchSpec.class);

        when(resourceNodeRepository.existsById(anyString())).thenReturn(true);
        when(neo4jClient.query(anyString())).thenReturn(unbound);
        doReturn(bound).when(unbound).bindAll(anyMap());
        doReturn(mappingSpec).when(bound).fetchAs(DependencyEdge.class);
        AtomicReference<BiFunction<TypeSystem, Record, DependencyEdge>> mapper = new AtomicReference<>();
        doAnswer(invocation -> {
            mapper.set(invocation.getArgument(0));
            return fetchSpec;
        }).when(mappingSpec).mappedBy(any());
        doAnswer(invocation -> List.of(mapper.get().apply(null, record))).when(fetchSpec).all();
    }
}
