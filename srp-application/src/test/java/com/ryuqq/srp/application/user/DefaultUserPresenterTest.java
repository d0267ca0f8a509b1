package com.ryuqq.srp.application.user;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.srp.core.model.UserFormat;
import com.ryuqq.srp.core.model.UserRecord;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DefaultUserPresenter 유닛 테스트.
 *
 * @author SRP Team
 * @since 1.0.0
 */
class DefaultUserPresenterTest {

    private final DefaultUserPresenter presenter = new DefaultUserPresenter();

    @Test
    void 콘솔_형식_고정_레이아웃() {
        UserRecord user = UserRecord.create("u123", "Alice Wonderland", "alice@example.com");

        assertThat(presenter.formatForConsole(user)).isEqualTo(
            "User ID: u123\n"
                + "Name: Alice Wonderland\n"
                + "Email: alice@example.com\n"
                + "Status: Active");
    }

    @Test
    void 콘솔_상태_문자열은_active와_일치() {
        UserRecord active = UserRecord.create("u1", "A", "a@b.c");
        UserRecord inactive = active.withActive(false);

        assertThat(presenter.formatForConsole(active)).contains("Status: Active").doesNotContain("Inactive");
        assertThat(presenter.formatForConsole(inactive)).contains("Status: Inactive");
    }

    @Test
    void JSON_형식_네_필드() throws Exception {
        UserRecord user = new UserRecord("u124", "Bob The Builder", "bob@example.net", false);

        String json = presenter.formatForJson(user);

        assertThat(json).isEqualTo(
            "{\"id\":\"u124\",\"name\":\"Bob The Builder\",\"email\":\"bob@example.net\",\"active\":false}");
        JsonNode node = new ObjectMapper().readTree(json);
        assertThat(node.size()).isEqualTo(4);
        assertThat(node.get("active").isBoolean()).isTrue();
    }

    @Test
    void JSON_특수문자_이스케이프() throws Exception {
        UserRecord user = UserRecord.create("u9", "Quote \"Q\" Back\\slash", "q@example.com");

        JsonNode node = new ObjectMapper().readTree(presenter.formatForJson(user));

        assertThat(node.get("name").asText()).isEqualTo("Quote \"Q\" Back\\slash");
    }

    @Test
    void format_default_메서드로_형식_분기() {
        UserRecord user = UserRecord.create("u1", "A", "a@b.c");

        assertThat(presenter.format(user, UserFormat.CONSOLE)).startsWith("User ID: u1");
        assertThat(presenter.format(user, UserFormat.JSON)).startsWith("{\"id\":\"u1\"");
    }

    @Test
    void null_레코드면_예외() {
        assertThatThrownBy(() -> presenter.formatForConsole(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> presenter.formatForJson(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DefaultUserPresenter(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
