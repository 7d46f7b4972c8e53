package com.heronix.callgate.model.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ValueTypesTest {

    @Test
    void addressIsNormalizedToLowercase() {
        Address address = Address.of("0x5FbDB2315678afecb367f032d93F642f64180aa3");

        assertThat(address.value()).isEqualTo("0x5fbdb2315678afecb367f032d93f642f64180aa3");
        assertThat(address).isEqualTo(Address.of("0x5fbdb2315678afecb367f032d93f642f64180aa3"));
        assertThat(Address.fromBytes(address.toBytes())).isEqualTo(address);
    }

    @Test
    void malformedAddressesAreRejected() {
        assertThatThrownBy(() -> Address.of("5fbdb2315678afecb367f032d93f642f64180aa3"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Address.of("0x5fbdb2"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Address.fromBytes(new byte[19]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void randomAddressesDiffer() {
        assertThat(Address.random()).isNotEqualTo(Address.random());
    }

    @Test
    void selectorIsDerivedFromSignature() {
        Selector selector = Selector.of("safeMint(address,uint256,bytes)");

        assertThat(selector.value()).isEqualTo("0x911760fd");
        assertThat(selector.toBytes()).hasSize(Selector.LENGTH);
        assertThat(Selector.of("mint(address,uint256)")).isEqualTo(Selector.parse("0x3950E061"));
    }

    @Test
    void moduleIdIsReadFromPayloadAfterMarker() {
        byte[] payload = new byte[64];
        payload[0] = (byte) 0xff;
        for (int i = ModuleId.OFFSET; i < ModuleId.OFFSET + ModuleId.LENGTH; i++) {
            payload[i] = 0x22;
        }

        ModuleId moduleId = ModuleId.fromPayload(payload);

        assertThat(moduleId.value()).isEqualTo("0x" + "22".repeat(32));
        assertThatThrownBy(() -> ModuleId.fromPayload(new byte[35]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
