package io.b2mash.b2b.projecthub.task;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.b2b.projecthub.TestcontainersConfiguration;
import io.b2mash.b2b.projecthub.testutil.TestAccounts;
import java.util.Map;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.graphql.tester.AutoConfigureHttpGraphQlTester;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.graphql.test.tester.HttpGraphQlTester;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@AutoConfigureMockMvc
@AutoConfigureHttpGraphQlTester
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class TaskWorkflowIntegrationTest {

  private static final String UPDATE_TASK =
      """
      mutation U($id: ID!, $input: UpdateTaskInput!) {
        updateTask(id: $id, input: $input) { success errors task { status completedAt } }
      }
      """;

  private static final String CREATE_COMMENT =
      """
      mutation C($input: CreateTaskCommentInput!) {
        createTaskComment(input: $input) { success errors comment { content authorEmail } }
      }
      """;

  @Autowired private HttpGraphQlTester graphQlTester;

  private TestAccounts accounts;
  private String ownerEmail;
  private String ownerToken;

  @BeforeAll
  void provisionOrganization() {
    accounts = new TestAccounts(graphQlTester);
    ownerEmail = TestAccounts.unique("olga") + "@acme.test";
    ownerToken = accounts.register(ownerEmail);
    accounts.createOrganization(ownerToken, "Workflow Org", TestAccounts.unique("flow"));
  }

  @Test
  void completingTwiceKeepsFirstCompletionTime() {
    var projectId = accounts.createProject(ownerToken, TestAccounts.unique("Launch"));
    var taskId = accounts.createTask(ownerToken, projectId, "Ship release", ownerEmail);

    var first =
        accounts
            .as(ownerToken)
            .document(UPDATE_TASK)
            .variable("id", taskId)
            .variable("input", Map.of("status", "DONE"))
            .execute();
    first.path("updateTask.task.status").entity(String.class).isEqualTo("DONE");
    String completedAt = first.path("updateTask.task.completedAt").entity(String.class).get();
    assertThat(completedAt).isNotBlank();

    accounts
        .as(ownerToken)
        .document(UPDATE_TASK)
        .variable("id", taskId)
        .variable("input", Map.of("status", "DONE"))
        .execute()
        .path("updateTask.task.completedAt")
        .entity(String.class)
        .isEqualTo(completedAt);

    accounts
        .as(ownerToken)
        .document(UPDATE_TASK)
        .variable("id", taskId)
        .variable("input", Map.of("status", "TODO"))
        .execute()
        .path("updateTask.task.completedAt")
        .valueIsNull();
  }

  @Test
  void progressReflectsTaskStatuses() {
    var projectId = accounts.createProject(ownerToken, TestAccounts.unique("Progress"));
    var done = accounts.createTask(ownerToken, projectId, "Done task", ownerEmail);
    accounts.createTask(ownerToken, projectId, "Open task", null);
    accounts.createTask(ownerToken, projectId, "Another open task", null);
    accounts
        .as(ownerToken)
        .document(UPDATE_TASK)
        .variable("id", done)
        .variable("input", Map.of("status", "DONE"))
        .execute()
        .path("updateTask.success")
        .entity(Boolean.class)
        .isEqualTo(true);

    var response =
        accounts
            .as(ownerToken)
            .document(
                """
                query P($id: ID!) {
                  project(id: $id) { progress { total todo done completionRate } }
                  taskStatistics(projectId: $id) { totalTasks completedTasks completionRate }
                }
                """)
            .variable("id", projectId)
            .execute();

    response.path("project.progress.total").entity(Integer.class).isEqualTo(3);
    response.path("project.progress.todo").entity(Integer.class).isEqualTo(2);
    response.path("project.progress.completionRate").entity(Double.class).isEqualTo(33.33);
    response.path("taskStatistics.totalTasks").entity(Integer.class).isEqualTo(3);
    response.path("taskStatistics.completedTasks").entity(Integer.class).isEqualTo(1);
  }

  @Test
  void commentsAreAttributedAndCounted() {
    var projectId = accounts.createProject(ownerToken, TestAccounts.unique("Comments"));
    var taskId = accounts.createTask(ownerToken, projectId, "Review design", null);

    accounts
        .as(ownerToken)
        .document(CREATE_COMMENT)
        .variable("input", Map.of("taskId", taskId, "content", "Looks good to me"))
        .execute()
        .path("createTaskComment.comment.authorEmail")
        .entity(String.class)
        .isEqualTo(ownerEmail);

    var spam =
        accounts
            .as(ownerToken)
            .document(CREATE_COMMENT)
            .variable("input", Map.of("taskId", taskId, "content", "Buy now!!!!!!!!!!!!!!"))
            .execute();
    spam.path("createTaskComment.success").entity(Boolean.class).isEqualTo(false);
    spam.path("createTaskComment.errors")
        .entityList(String.class)
        .containsExactly("Comment content appears to contain spam");

    accounts
        .as(ownerToken)
        .document("query T($id: ID!) { task(id: $id) { commentCount comments { content } } }")
        .variable("id", taskId)
        .execute()
        .path("task.commentCount")
        .entity(Integer.class)
        .isEqualTo(1);
  }

  @Test
  void pastDueDateIsRejectedInPayload() {
    var response =
        accounts
            .as(ownerToken)
            .document(
                """
                mutation {
                  createProject(input: {name: "Backdated", dueDate: "2000-01-01"}) {
                    success errors project { id }
                  }
                }
                """)
            .execute();

    response.path("createProject.success").entity(Boolean.class).isEqualTo(false);
    response
        .path("createProject.errors")
        .entityList(String.class)
        .containsExactly("Project due date cannot be in the past");
    response.path("createProject.project").valueIsNull();
  }

  @Test
  void projectsPageByOffsetCursor() {
    var token = accounts.register(TestAccounts.unique("pia") + "@acme.test");
    accounts.createOrganization(token, "Paging Org", TestAccounts.unique("paging"));
    accounts.createProject(token, "Alpha");
    accounts.createProject(token, "Bravo");
    accounts.createProject(token, "Charlie");
    var query =
        """
        query Page($after: String) {
          projects(first: 2, after: $after, sortBy: NAME, sortOrder: ASC) {
            totalCount
            items { name }
            pageInfo { hasNextPage hasPreviousPage endCursor }
          }
        }
        """;

    var first = accounts.as(token).document(query).execute();
    first.path("projects.totalCount").entity(Integer.class).isEqualTo(3);
    first.path("projects.items[*].name").entityList(String.class).containsExactly("Alpha", "Bravo");
    first.path("projects.pageInfo.hasNextPage").entity(Boolean.class).isEqualTo(true);
    first.path("projects.pageInfo.endCursor").entity(String.class).isEqualTo("2");

    var second = accounts.as(token).document(query).variable("after", "2").execute();
    second.path("projects.items[*].name").entityList(String.class).containsExactly("Charlie");
    second.path("projects.pageInfo.hasNextPage").entity(Boolean.class).isEqualTo(false);
    second.path("projects.pageInfo.hasPreviousPage").entity(Boolean.class).isEqualTo(true);
  }
}
