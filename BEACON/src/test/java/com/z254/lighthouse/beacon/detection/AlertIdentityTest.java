package com.z254.lighthouse.beacon.detection;

import com.z254.lighthouse.beacon.domain.model.AlertType;
import com.z254.lighthouse.beacon.domain.model.Entity;
import com.z254.lighthouse.beacon.domain.model.EntityType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AlertIdentityTest {

    private final Entity keyword = Entity.builder()
            .id("kw-1")
            .type(EntityType.KEYWORD)
            .product("acme")
            .campaign("")
            .adGroup("ag-7")
            .keyword("running shoes")
            .build();

    @Test
    @DisplayName("should join type and populated coordinates with colons")
    void canonicalKeySkipsMissingParts() {
        assertThat(AlertIdentity.canonicalKey(AlertType.CPC_JUMP, keyword))
                .isEqualTo("cpc_jump:keyword:acme:ag-7:running shoes");
        assertThat(AlertIdentity.of(AlertType.CPC_JUMP, keyword)).isEqualTo("511ece34c2982782");
    }

    @Test
    @DisplayName("should fall back to the URL when the entity has no keyword")
    void urlEntityKey() {
        Entity page = Entity.builder()
                .id("e1")
                .type(EntityType.URL)
                .product("acme")
                .url("https://acme.example/a")
                .build();

        assertThat(AlertIdentity.canonicalKey(AlertType.LP_REGRESSION, page))
                .isEqualTo("lp_regression:url:acme:https://acme.example/a");
        assertThat(AlertIdentity.of(AlertType.LP_REGRESSION, page)).isEqualTo("0e736e3cb7b825e8");
    }

    @Test
    @DisplayName("should tell apart pages that share an entity id")
    void distinctUrlsDistinctIds() {
        Entity first = Entity.builder().id("e1").type(EntityType.URL).product("acme")
                .url("https://acme.example/a").build();
        Entity second = Entity.builder().id("e1").type(EntityType.URL).product("acme")
                .url("https://acme.example/b").build();

        assertThat(AlertIdentity.of(AlertType.LP_REGRESSION, second))
                .isEqualTo("7745319f2afdf40b")
                .isNotEqualTo(AlertIdentity.of(AlertType.LP_REGRESSION, first));
    }

    @Test
    @DisplayName("should ignore the entity id")
    void entityIdNotPartOfKey() {
        Entity renamed = Entity.builder()
                .id("kw-99")
                .type(EntityType.KEYWORD)
                .product("acme")
                .adGroup("ag-7")
                .keyword("running shoes")
                .build();

        assertThat(AlertIdentity.of(AlertType.CPC_JUMP, renamed))
                .isEqualTo(AlertIdentity.of(AlertType.CPC_JUMP, keyword));
    }

    @Test
    @DisplayName("should use the first sixteen hex characters of the MD5 digest")
    void md5Prefix() {
        assertThat(AlertIdentity.fingerprint("abc")).isEqualTo("900150983cd24fb0");
        assertThat(AlertIdentity.fingerprint("")).isEqualTo("d41d8cd98f00b204");
    }

    @Test
    @DisplayName("should be stable for equal inputs and differ across alert types")
    void deterministic() {
        Entity copy = Entity.builder()
                .id("kw-1")
                .type(EntityType.KEYWORD)
                .product("acme")
                .adGroup("ag-7")
                .keyword("running shoes")
                .build();

        assertThat(AlertIdentity.of(AlertType.CPC_JUMP, keyword))
                .isEqualTo(AlertIdentity.of(AlertType.CPC_JUMP, copy))
                .hasSize(16)
                .matches("[0-9a-f]{16}")
                .isNotEqualTo(AlertIdentity.of(AlertType.CTR_DROP, keyword));
    }
}
