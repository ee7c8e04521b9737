package com.codeheadsystems.p9sk.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class AttributesTest {

  @Test
  void parse_valuesQueriesAndBareNames() {
    Attributes attrs = Attributes.parse("proto=p9sk1  dom=example user? flag");

    assertThat(attrs.find("proto")).contains("p9sk1");
    assertThat(attrs.find("dom")).contains("example");
    assertThat(attrs.find("user")).isEmpty();
    assertThat(attrs.has("user")).isFalse();
    assertThat(attrs.queries()).containsExactly("user");
    assertThat(attrs.find("flag")).contains("");
  }

  @Test
  void parse_quotedValues() {
    Attributes attrs = Attributes.parse("user='glenda the good' note='it''s'");

    assertThat(attrs.find("user")).contains("glenda the good");
    assertThat(attrs.find("note")).contains("it's");
  }

  @Test
  void parse_unterminatedQuote() {
    assertThatThrownBy(() -> Attributes.parse("user='glenda"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Unterminated");
  }

  @Test
  void parse_emptyName() {
    assertThatThrownBy(() -> Attributes.parse("=value"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Attributes.parse("?"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void parse_emptyText() {
    assertThat(Attributes.parse("   ").isEmpty()).isTrue();
    assertThat(Attributes.parse("")).isEqualTo(Attributes.empty());
  }

  @Test
  void toString_hidesPrivateValues() {
    Attributes attrs = Attributes.parse("user=alice !password=secret dom?");

    assertThat(attrs.toString()).isEqualTo("user=alice !password? dom?");
    assertThat(attrs.toString()).doesNotContain("secret");
  }

  @Test
  void toString_quotesWhenNeeded() {
    Attributes attrs = Attributes.empty().with("user", "a b").with("empty", "");

    assertThat(attrs.toString()).isEqualTo("user='a b' empty=''");
    assertThat(Attributes.parse(attrs.toString())).isEqualTo(attrs);
  }

  @Test
  void publicAttributes_dropsPrivateEntries() {
    Attributes attrs = Attributes.parse("user=alice !password=secret !hex?");

    assertThat(attrs.publicAttributes()).isEqualTo(Attributes.parse("user=alice"));
    assertThat(Attributes.isPrivate("!password")).isTrue();
    assertThat(Attributes.isPrivate("user")).isFalse();
  }

  @Test
  void with_replacesValueAndQuery() {
    Attributes attrs = Attributes.parse("user? dom=a").with("user", "alice").with("dom", "b");

    assertThat(attrs).isEqualTo(Attributes.parse("user=alice dom=b"));
  }

  @Test
  void query_doesNotOverrideValue() {
    Attributes attrs = Attributes.parse("user=alice").query("user").query("dom");

    assertThat(attrs.find("user")).contains("alice");
    assertThat(attrs.queries()).containsExactly("dom");
  }

  @Test
  void without_removesEntry() {
    Attributes attrs = Attributes.parse("role=client user=alice");

    assertThat(attrs.without("role")).isEqualTo(Attributes.parse("user=alice"));
    assertThat(attrs.without("absent")).isSameAs(attrs);
  }

  @Test
  void plus_appliesValuesAndQueries() {
    Attributes base = Attributes.parse("user=alice dom=a");
    Attributes merged = base.plus(Attributes.parse("dom=b user? proto?"));

    assertThat(merged.find("user")).contains("alice");
    assertThat(merged.find("dom")).contains("b");
    assertThat(merged.queries()).containsExactly("proto");
  }

  @Test
  void satisfies_matchesValuesAndRequiresQueried() {
    Attributes key = Attributes.parse("proto=p9sk1 dom=example user=alice");

    assertThat(key.satisfies(Attributes.parse("proto=p9sk1 user?"))).isTrue();
    assertThat(key.satisfies(Attributes.empty())).isTrue();
    assertThat(key.satisfies(Attributes.parse("dom=other"))).isFalse();
    assertThat(key.satisfies(Attributes.parse("role?"))).isFalse();
  }

  @Test
  void attributes_areImmutable() {
    Attributes attrs = Attributes.parse("user=alice");
    attrs.with("dom", "example");

    assertThat(attrs.has("dom")).isFalse();
  }
}
