package com.mockinterview.platform.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mockinterview.platform.config.AppConfig;
import com.mockinterview.platform.config.DataStoreProperties;
import com.mockinterview.platform.config.StorageProperties;
import com.mockinterview.platform.exception.ErrorKind;
import com.mockinterview.platform.exception.InterviewPlatformException;
import com.mockinterview.platform.model.*;
import com.mockinterview.platform.repository.*;
import com.mockinterview.platform.service.CommunicationManager;
import com.mockinterview.platform.service.FileStorageService;
import com.mockinterview.platform.service.SessionLockRegistry;
import io.github.resilience4j.retry.Retry;
import jakarta.persistence.EntityManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JpaDataStoreTest {

    @Mock
    private InterviewSessionRepository sessionRepository;
    @Mock
    private ConversationMessageRepository messageRepository;
    @Mock
    private MediaFileRepository mediaFileRepository;
    @Mock
    private TokenUsageRepository tokenUsageRepository;
    @Mock
    private EvaluationRepository evaluationRepository;
    @Mock
    private ResumeRepository resumeRepository;
    @Mock
    private AuditLogRepository auditLogRepository;
    @Mock
    private ActiveModeRepository activeModeRepository;
    @Mock
    private EntityManager entityManager;
    @Mock
    private PlatformTransactionManager transactionManager;

    private JpaDataStore dataStore;

    @BeforeEach
    void setUp() {
        DataStoreProperties properties = new DataStoreProperties();
        properties.setInitialBackoff(Duration.ofMillis(1));
        AppConfig config = new AppConfig();
        Retry retry = config.dataStoreRetry(config.dataStoreRetryConfig(properties));
        ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

        dataStore = new JpaDataStore(sessionRepository, messageRepository, mediaFileRepository,
                tokenUsageRepository, evaluationRepository, resumeRepository, auditLogRepository,
                activeModeRepository, entityManager, new TransactionTemplate(transactionManager), retry, objectMapper);
    }

    @Test
    void transientFailureIsRetriedOnce() {
        MediaFile file = mediaFile(1);
        when(mediaFileRepository.save(file))
                .thenThrow(new TransientDataAccessResourceException("connection reset"))
                .thenReturn(file);

        assertThat(dataStore.saveMediaFile(file)).isSameAs(file);
        verify(mediaFileRepository, times(2)).save(file);
    }

    @Test
    void exhaustedRetriesBecomeDataStoreError() {
        when(sessionRepository.findById("s-1"))
                .thenThrow(new TransientDataAccessResourceException("database is down"));

        assertThatThrownBy(() -> dataStore.findSession("s-1"))
                .isInstanceOf(InterviewPlatformException.class)
                .hasFieldOrPropertyWithValue("kind", ErrorKind.DATA_STORE)
                .hasFieldOrPropertyWithValue("subsystem", "database")
                .hasMessageContaining("get session");
        verify(sessionRepository, times(3)).findById("s-1");
    }

    @Test
    void constraintViolationsAreNotRetried() {
        MediaFile file = mediaFile(1);
        when(mediaFileRepository.save(file)).thenThrow(new DataIntegrityViolationException("duplicate sequence"));

        assertThatThrownBy(() -> dataStore.saveMediaFile(file))
                .hasFieldOrPropertyWithValue("kind", ErrorKind.DATA_STORE);
        verify(mediaFileRepository, times(1)).save(file);
    }

    @Test
    void whiteboardSaveSurvivesOneTransientFailure(@TempDir Path sessionsDir) throws Exception {
        InterviewSession session = InterviewSession.builder()
                .id("s-1")
                .status(SessionStatus.ACTIVE)
                .enabledModes(Set.of(CommunicationMode.WHITEBOARD))
                .build();
        when(sessionRepository.findById("s-1")).thenReturn(Optional.of(session));
        when(mediaFileRepository.findMaxSequence("s-1", MediaKind.WHITEBOARD)).thenReturn(0);
        when(mediaFileRepository.save(any()))
                .thenThrow(new TransientDataAccessResourceException("connection reset"))
                .thenAnswer(invocation -> invocation.getArgument(0));
        StorageProperties storage = new StorageProperties();
        storage.setSessionsDir(sessionsDir.toString());
        CommunicationManager communicationManager = new CommunicationManager(
                dataStore, new FileStorageService(storage), new SessionLockRegistry());

        String path = communicationManager.saveWhiteboard("s-1", new byte[]{7, 7});

        assertThat(Paths.get(path).getFileName().toString()).isEqualTo("snapshot_001.png");
        ArgumentCaptor<MediaFile> saved = ArgumentCaptor.forClass(MediaFile.class);
        verify(mediaFileRepository, times(2)).save(saved.capture());
        assertThat(saved.getAllValues()).extracting(MediaFile::getId).containsOnly(saved.getValue().getId());
        try (var files = Files.list(sessionsDir.resolve("s-1").resolve("whiteboard"))) {
            assertThat(files.count()).isEqualTo(1);
        }
    }

    @Test
    void nextSequenceFollowsStoredMaximum() {
        when(mediaFileRepository.findMaxSequence("s-1", MediaKind.WHITEBOARD)).thenReturn(4);

        assertThat(dataStore.nextMediaSequence("s-1", MediaKind.WHITEBOARD)).isEqualTo(5);
    }

    @Test
    void secondEvaluationIsRejectedWithoutWriting() {
        when(evaluationRepository.existsById("s-1")).thenReturn(true);

        assertThatThrownBy(() -> dataStore.saveEvaluation(report("s-1")))
                .hasFieldOrPropertyWithValue("kind", ErrorKind.CONFIGURATION)
                .hasMessage("Evaluation for session s-1 already exists");
        verify(evaluationRepository, never()).save(any());
    }

    @Test
    void evaluationSurvivesStorageRoundTrip() {
        EvaluationReport report = report("s-1");
        when(evaluationRepository.existsById("s-1")).thenReturn(false);
        when(evaluationRepository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));
        dataStore.saveEvaluation(report);

        ArgumentCaptor<EvaluationRecord> captor = ArgumentCaptor.forClass(EvaluationRecord.class);
        verify(evaluationRepository).save(captor.capture());
        when(evaluationRepository.findById("s-1")).thenReturn(Optional.of(captor.getValue()));

        EvaluationReport loaded = dataStore.findEvaluation("s-1").orElseThrow();
        assertThat(loaded.getOverallScore()).isEqualTo(72.5);
        assertThat(loaded.getCompetencyScores().get("Data Modeling").getConfidenceLevel()).isEqualTo(ConfidenceLevel.HIGH);
        assertThat(loaded.getWentWell()).extracting(FeedbackItem::getDescription).containsExactly("Clear API");
        assertThat(loaded.getNeedsImprovement()).isEmpty();
        assertThat(loaded.getImprovementPlan().getConcreteSteps()).extracting(ActionItem::getStepNumber).containsExactly(1);
    }

    @Test
    void completeSessionFailsForDeletedSession() {
        InterviewSession session = InterviewSession.builder().id("s-1").status(SessionStatus.COMPLETED).build();
        when(sessionRepository.existsById("s-1")).thenReturn(false);

        assertThatThrownBy(() -> dataStore.completeSession(session, report("s-1")))
                .hasMessage("Session s-1 not found");
        verify(sessionRepository, never()).save(any());
        verify(transactionManager).rollback(any());
    }

    @Test
    void deleteRemovesDependentsInOneTransaction() {
        when(sessionRepository.existsById("s-1")).thenReturn(true);
        when(evaluationRepository.findById("s-1")).thenReturn(Optional.empty());
        when(activeModeRepository.findById("s-1")).thenReturn(Optional.empty());

        assertThat(dataStore.deleteSession("s-1")).isTrue();

        verify(messageRepository).deleteBySessionId("s-1");
        verify(mediaFileRepository).deleteBySessionId("s-1");
        verify(tokenUsageRepository).deleteBySessionId("s-1");
        verify(sessionRepository).deleteById("s-1");
        verify(transactionManager).commit(any());
    }

    @Test
    void auditWritesAreNotRetried() {
        when(auditLogRepository.save(any())).thenThrow(new TransientDataAccessResourceException("timeout"));

        assertThatThrownBy(() -> dataStore.appendAuditLog("SessionManager", "create_session", "s-1", "created"))
                .hasFieldOrPropertyWithValue("kind", ErrorKind.DATA_STORE);
        verify(auditLogRepository, times(1)).save(any());
    }

    @Test
    void healthCheckReportsDatabaseFailure() {
        when(sessionRepository.count()).thenThrow(new TransientDataAccessResourceException("down"));

        assertThat(dataStore.healthCheck()).isFalse();
    }

    private static MediaFile mediaFile(int sequence) {
        return MediaFile.builder()
                .id("m-" + sequence)
                .sessionId("s-1")
                .kind(MediaKind.WHITEBOARD)
                .filePath("data/sessions/s-1/whiteboard/" + MediaKind.WHITEBOARD.fileName(sequence))
                .sequence(sequence)
                .sizeBytes(3L)
                .createdAt(LocalDateTime.now())
                .build();
    }

    private static EvaluationReport report(String sessionId) {
        EvaluationReport report = EvaluationReport.builder()
                .sessionId(sessionId)
                .overallScore(72.5)
                .wentWell(List.of(FeedbackItem.of("Clear API")))
                .communicationModeAnalysis(ModeAnalysis.builder().overallCommunication("Good").build())
                .improvementPlan(ImprovementPlan.builder()
                        .concreteSteps(List.of(ActionItem.builder().stepNumber(1).description("Practice").build()))
                        .build())
                .createdAt(LocalDateTime.now())
                .build();
        report.getCompetencyScores().put("Data Modeling", CompetencyScore.builder()
                .score(80).confidenceLevel(ConfidenceLevel.HIGH).build());
        return report;
    }
}
