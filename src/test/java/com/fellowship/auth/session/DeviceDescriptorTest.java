package com.fellowship.auth.session;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DeviceDescriptorTest {

    @Test
    void describesCommonUserAgents() {
        assertThat(DeviceDescriptor.describe("Mozilla/5.0 (iPhone; CPU iPhone OS 17_0 like Mac OS X)")).isEqualTo("iPhone");
        assertThat(DeviceDescriptor.describe("Mozilla/5.0 (iPad; CPU OS 16_0 like Mac OS X)")).isEqualTo("iPad");
        assertThat(DeviceDescriptor.describe("Mozilla/5.0 (Linux; Android 14; Pixel 8)")).isEqualTo("Android Device");
        assertThat(DeviceDescriptor.describe("Mozilla/5.0 (Windows NT 10.0; Win64; x64)")).isEqualTo("Windows Computer");
        assertThat(DeviceDescriptor.describe("Mozilla/5.0 (Macintosh; Intel Mac OS X 14_0)")).isEqualTo("Mac Computer");
        assertThat(DeviceDescriptor.describe("Mozilla/5.0 (X11; Linux x86_64)")).isEqualTo("Linux Computer");
    }

    @Test
    void unknownOrMissingUserAgent() {
        assertThat(DeviceDescriptor.describe(null)).isEqualTo("Unknown Device");
        assertThat(DeviceDescriptor.describe("")).isEqualTo("Unknown Device");
        assertThat(DeviceDescriptor.describe("curl/8.4.0")).isEqualTo("Unknown Device");
    }
}
