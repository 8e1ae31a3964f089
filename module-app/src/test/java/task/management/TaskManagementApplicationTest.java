package task.management;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import task.management.grpc.GrpcServerLifecycle;
import task.management.infrastructure.mongodb.document.TaskDocument;
import task.management.infrastructure.mongodb.document.UserDocument;

/**
 * 전체 컨텍스트 E2E 테스트 (MongoDB 컨테이너 + 실제 보안 필터 체인 + gRPC 서버)
 *
 * <p>Docker가 없으면 건너뜁니다.
 */
@Tag("integration")
@SpringBootTest(properties = {"grpc.server.port=0"})
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("애플리케이션 E2E 테스트")
class TaskManagementApplicationTest {

  @Container @ServiceConnection
  static MongoDBContainer mongoDBContainer =
      new MongoDBContainer(DockerImageName.parse("mongo:7.0"));

  @Autowired private MockMvc mockMvc;
  @Autowired private MongoTemplate mongoTemplate;
  @Autowired private GrpcServerLifecycle grpcServerLifecycle;

  @BeforeEach
  void cleanUp() {
    mongoTemplate.remove(new Query(), UserDocument.class);
    mongoTemplate.remove(new Query(), TaskDocument.class);
  }

  private String register(String username, String email) throws Exception {
    MvcResult result =
        mockMvc
            .perform(
                post("/api/v1/auth/register")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        String.format(
                            "{\"username\":\"%s\",\"email\":\"%s\",\"password\":\"secret1\"}",
                            username, email)))
            .andExpect(status().isCreated())
            .andReturn();
    return JsonPath.read(result.getResponse().getContentAsString(), "$.data.id");
  }

  private String login(String login) throws Exception {
    MvcResult result =
        mockMvc
            .perform(
                post("/api/v1/auth/login")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"login\":\"" + login + "\",\"password\":\"secret1\"}"))
            .andExpect(status().isOk())
            .andReturn();
    return "Bearer "
        + JsonPath.read(result.getResponse().getContentAsString(), "$.data.access_token");
  }

  @Test
  @DisplayName("gRPC 서버가 임의 포트로 기동된다")
  void grpcServerRunning() {
    assertThat(grpcServerLifecycle.isRunning()).isTrue();
    assertThat(grpcServerLifecycle.getPort()).isPositive();
  }

  @Test
  @DisplayName("alice/bob 시나리오: 가입, 중복, 생성, 권한, 지정, 상태 전이, 사용자별 목록")
  void aliceAndBob() throws Exception {
    String aliceId = register("alice", "alice@x.com");
    String bobId = register("bob", "bob@x.com");

    mockMvc
        .perform(
            post("/api/v1/auth/register")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"username\":\"alice2\",\"email\":\"alice@x.com\",\"password\":\"secret1\"}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.error.code").value("U003"));

    String alice = login("alice@x.com");
    String bob = login("bob");

    MvcResult created =
        mockMvc
            .perform(
                post("/api/v1/tasks")
                    .header("Authorization", alice)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"title\":\"Write report\",\"priority\":2}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.data.status").value("pending"))
            .andExpect(jsonPath("$.data.created_by").value(aliceId))
            .andReturn();
    String taskId = JsonPath.read(created.getResponse().getContentAsString(), "$.data.id");

    mockMvc
        .perform(delete("/api/v1/tasks/{id}", taskId).header("Authorization", bob))
        .andExpect(status().isForbidden());

    mockMvc
        .perform(
            post("/api/v1/tasks/{id}/assign", taskId)
                .header("Authorization", alice)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"assignee_id\":\"" + bobId + "\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.status").value("in_progress"));

    mockMvc
        .perform(
            put("/api/v1/tasks/{id}", taskId)
                .header("Authorization", bob)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\":\"completed\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.status").value("completed"));

    mockMvc
        .perform(get("/api/v1/users/{id}/tasks", bobId).header("Authorization", bob))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data[0].id").value(taskId));

    mockMvc
        .perform(get("/api/v1/me").header("Authorization", bob))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.username").value("bob"));

    mockMvc
        .perform(get("/api/v1/tasks/{id}", taskId))
        .andExpect(status().isUnauthorized());
  }
}
