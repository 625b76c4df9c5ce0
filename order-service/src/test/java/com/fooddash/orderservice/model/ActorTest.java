package com.fooddash.orderservice.model;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActorTest {

    @Test
    void users_with_same_id_are_equal() {
        UUID userId = UUID.randomUUID();

        assertThat(Actor.user(userId)).isEqualTo(Actor.user(userId));
        assertThat(Actor.user(userId)).hasSameHashCodeAs(Actor.user(userId));
        assertThat(Actor.user(userId)).isNotEqualTo(Actor.user(UUID.randomUUID()));
    }

    @Test
    void system_actor_has_no_user() {
        assertThat(Actor.system().getType()).isEqualTo(ActorType.SYSTEM);
        assertThat(Actor.system().getUserId()).isNull();
        assertThat(Actor.system()).hasToString("system");
    }

    @Test
    void user_actor_prints_its_id() {
        UUID userId = UUID.randomUUID();

        assertThat(Actor.user(userId)).hasToString(userId.toString());
    }

    @Test
    void user_actor_requires_an_id() {
        assertThatThrownBy(() -> Actor.user(null)).isInstanceOf(NullPointerException.class);
    }
}
