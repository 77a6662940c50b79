package io.b2mash.b2b.projecthub.multitenancy;

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
import org.springframework.graphql.test.tester.GraphQlTester;
import org.springframework.graphql.test.tester.HttpGraphQlTester;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@AutoConfigureMockMvc
@AutoConfigureHttpGraphQlTester
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class TenantIsolationIntegrationTest {

  @Autowired private HttpGraphQlTester graphQlTester;

  private TestAccounts accounts;

  private String acmeSlug;
  private String aliceToken;
  private String bobToken;
  private String carolToken;
  private String carolEmail;
  private String acmeProjectId;
  private String acmeTaskId;
  private String globexProjectId;

  @BeforeAll
  void provisionTwoOrganizations() {
    accounts = new TestAccounts(graphQlTester);

    acmeSlug = TestAccounts.unique("acme");
    aliceToken = accounts.register(TestAccounts.unique("alice") + "@acme.test");
    accounts.createOrganization(aliceToken, "Acme", acmeSlug);

    bobToken = accounts.register(TestAccounts.unique("bob") + "@globex.test");
    accounts.createOrganization(bobToken, "Globex", TestAccounts.unique("globex"));

    carolEmail = TestAccounts.unique("carol") + "@acme.test";
    carolToken = accounts.register(carolEmail);
    accounts.addMember(aliceToken, carolEmail, false);

    acmeProjectId = accounts.createProject(aliceToken, "Acme Website");
    acmeTaskId = accounts.createTask(aliceToken, acmeProjectId, "Draft copy", carolEmail);
    globexProjectId = accounts.createProject(bobToken, "Globex Portal");
  }

  @Test
  void eachOrganizationListsOnlyItsProjects() {
    accounts
        .as(bobToken)
        .document("{ projects { totalCount items { id } } }")
        .execute()
        .path("projects.items[*].id")
        .entityList(String.class)
        .containsExactly(globexProjectId);

    accounts
        .as(aliceToken)
        .document("{ projects { totalCount items { id } } }")
        .execute()
        .path("projects.items[*].id")
        .entityList(String.class)
        .containsExactly(acmeProjectId);
  }

  @Test
  void foreignProjectIsNotFound() {
    var response =
        accounts
            .as(bobToken)
            .document("query P($id: ID!) { project(id: $id) { id name } }")
            .variable("id", acmeProjectId)
            .execute();

    expectCode(response, "NOT_FOUND");
    response.path("project").valueIsNull();
  }

  @Test
  void namingForeignOrganizationIsDenied() {
    var response =
        accounts.as(bobToken, acmeSlug).document("{ projects { totalCount } }").execute();

    expectCode(response, "TENANT_ACCESS_DENIED");
  }

  @Test
  void namingOwnOrganizationIsAllowed() {
    accounts
        .as(aliceToken, acmeSlug)
        .document("{ organization { slug } }")
        .execute()
        .path("organization.slug")
        .entity(String.class)
        .isEqualTo(acmeSlug);
  }

  @Test
  void foreignTaskCannotBeUpdated() {
    var response =
        accounts
            .as(bobToken)
            .document(
                """
                mutation U($id: ID!, $input: UpdateTaskInput!) {
                  updateTask(id: $id, input: $input) { success }
                }
                """)
            .variable("id", acmeTaskId)
            .variable("input", Map.of("title", "Hijacked"))
            .execute();

    expectCode(response, "NOT_FOUND");
  }

  @Test
  void foreignTaskCommentsAreNotFound() {
    var response =
        accounts
            .as(bobToken)
            .document("query C($id: ID!) { taskComments(taskId: $id) { totalCount } }")
            .variable("id", acmeTaskId)
            .execute();

    expectCode(response, "NOT_FOUND");
  }

  @Test
  void memberCannotDeleteProject() {
    var response =
        accounts
            .as(carolToken)
            .document("mutation D($id: ID!) { deleteProject(id: $id) { success } }")
            .variable("id", acmeProjectId)
            .execute();

    expectCode(response, "PERMISSION_DENIED");
  }

  @Test
  void assigneeCanUpdateOwnTask() {
    accounts
        .as(carolToken)
        .document(
            """
            mutation U($id: ID!, $input: UpdateTaskInput!) {
              updateTask(id: $id, input: $input) { success task { status } }
            }
            """)
        .variable("id", acmeTaskId)
        .variable("input", Map.of("status", "IN_PROGRESS"))
        .execute()
        .path("updateTask.task.status")
        .entity(String.class)
        .isEqualTo("IN_PROGRESS");
  }

  @Test
  void usersAndStatisticsAreScoped() {
    var response =
        accounts
            .as(bobToken)
            .document(
                """
                {
                  users { email }
                  organizationStatistics { userCount projectStats { totalProjects } }
                }
                """)
            .execute();

    response.path("users[*].email").entityList(String.class).hasSize(1);
    response.path("organizationStatistics.userCount").entity(Integer.class).isEqualTo(1);
    response
        .path("organizationStatistics.projectStats.totalProjects")
        .entity(Integer.class)
        .isEqualTo(1);
  }

  @Test
  void foreignProjectHealthIsNotFound() {
    var response =
        accounts
            .as(bobToken)
            .document("query H($id: ID!) { projectHealthScore(projectId: $id) }")
            .variable("id", acmeProjectId)
            .execute();

    expectCode(response, "NOT_FOUND");
  }

  @Test
  void assigneeDistributionIsScoped() {
    var query = "{ taskDistributionByAssignee { assigneeEmail totalTasks } }";

    accounts
        .as(aliceToken)
        .document(query)
        .execute()
        .path("taskDistributionByAssignee[*].assigneeEmail")
        .entityList(String.class)
        .containsExactly(carolEmail);

    accounts
        .as(bobToken)
        .document(query)
        .execute()
        .path("taskDistributionByAssignee")
        .entityList(Object.class)
        .hasSize(0);
  }

  private static void expectCode(GraphQlTester.Response response, String code) {
    response
        .errors()
        .satisfy(
            errors ->
                assertThat(errors)
                    .singleElement()
                    .satisfies(e -> assertThat(e.getExtensions()).containsEntry("code", code)));
  }
}
