package com.codeheadsystems.p9sk.protocol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.p9sk.codec.WireCodec;
import com.codeheadsystems.p9sk.common.Attributes;
import com.codeheadsystems.p9sk.exceptions.KeyResolutionException;
import com.codeheadsystems.p9sk.exceptions.RoleResolutionException;
import com.codeheadsystems.p9sk.keystore.InMemoryKeyStore;
import com.codeheadsystems.p9sk.model.AuthType;
import com.codeheadsystems.p9sk.model.Role;
import com.codeheadsystems.p9sk.model.TicketRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class P9skProtocolTest {

  private InMemoryKeyStore keyStore;
  private P9skProtocol protocol;

  @BeforeEach
  void setUp() {
    keyStore = new InMemoryKeyStore();
    keyStore.addKey("proto=p9sk1 dom=example user=alice !password=alicepw role=server");
    keyStore.addKey("proto=other dom=example user=mallory !password=x role=server");
    protocol = new P9skProtocol(keyStore, new TestIssuer(), ProtocolConfig.DEFAULT);
  }

  @Test
  void start_requiresRole() {
    assertThatThrownBy(() -> protocol.start(Variant.P9SK1, Attributes.parse("user=alice")))
        .isInstanceOf(RoleResolutionException.class)
        .hasMessage("role not specified");
  }

  @Test
  void start_rejectsUnknownRole() {
    assertThatThrownBy(() -> protocol.start(Variant.P9SK1, Attributes.parse("role=bystander")))
        .isInstanceOf(RoleResolutionException.class)
        .hasMessage("unknown role: bystander");
  }

  @Test
  void start_dispatchesOnRole() {
    assertThat(protocol.start(Variant.P9SK1, Attributes.parse("role=client")).role()).isEqualTo(Role.CLIENT);
    assertThat(protocol.start(Variant.P9SK1, Attributes.parse("role=server")).role()).isEqualTo(Role.SERVER);
  }

  @Test
  void startClient_acquiresNoKey() {
    protocol.startClient(Variant.P9SK1, Attributes.empty());
    protocol.startClient(Variant.P9SK2, Attributes.empty());

    assertThat(keyStore.outstanding()).isZero();
  }

  @Test
  void startServer_buildsTicketRequestFromKey() {
    Session server = protocol.startServer(Variant.P9SK2, Attributes.parse("dom=example"));

    TicketRequest request = WireCodec.decodeTicketRequest(server.read(), 0);

    assertThat(request.type()).isEqualTo(AuthType.TICKET_REQUEST.code());
    assertThat(request.authId()).isEqualTo("alice");
    assertThat(request.authDomain()).isEqualTo("example");
    assertThat(request.hostId()).isEmpty();
    assertThat(request.uid()).isEmpty();
    assertThat(keyStore.outstanding()).isEqualTo(1);
  }

  @Test
  void startServer_onlyUsesP9sk1Keys() {
    assertThatThrownBy(() -> protocol.startServer(Variant.P9SK1, Attributes.parse("user=mallory")))
        .isInstanceOf(KeyResolutionException.class)
        .hasMessageContaining("proto=p9sk1");
  }

  @Test
  void startServer_noKey() {
    assertThatThrownBy(() -> protocol.startServer(Variant.P9SK1, Attributes.parse("dom=nowhere")))
        .isInstanceOf(KeyResolutionException.class);
    assertThat(keyStore.outstanding()).isZero();
  }

  @Test
  void forTesting_repeatsChallenges() {
    P9skProtocol first = new P9skProtocol(keyStore, new TestIssuer(), ProtocolConfig.forTesting(7L));
    P9skProtocol second = new P9skProtocol(keyStore, new TestIssuer(), ProtocolConfig.forTesting(7L));

    assertThat(first.startClient(Variant.P9SK1, Attributes.empty()).read())
        .isEqualTo(second.startClient(Variant.P9SK1, Attributes.empty()).read());
  }

  @Test
  void clientKeyPattern_asksForUserAndPassword() {
    Attributes pattern = P9skProtocol.clientKeyPattern(
        Attributes.parse("role=client user=bob dom=stale"), "p9sk1", "example");

    assertThat(pattern.find("role")).isEmpty();
    assertThat(pattern.find("user")).contains("bob");
    assertThat(pattern.find("dom")).contains("example");
    assertThat(pattern.find("proto")).contains("p9sk1");
    assertThat(pattern.queries()).containsExactly("!password");
  }

  @Test
  void variant_names() {
    assertThat(Variant.fromName("p9sk1")).isEqualTo(Variant.P9SK1);
    assertThat(Variant.fromName("p9sk2")).isEqualTo(Variant.P9SK2);
    assertThat(Variant.P9SK1.keyPrompt()).contains("user? !password?");
    assertThat(Variant.P9SK2.keyPrompt()).isEmpty();
    assertThat(Variant.P9SK1.initiatorSendsChallenge()).isTrue();
    assertThat(Variant.P9SK2.initiatorSendsChallenge()).isFalse();
    assertThatThrownBy(() -> Variant.fromName("p9sk3")).isInstanceOf(IllegalArgumentException.class);
  }
}
