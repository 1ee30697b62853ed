package io.binpack.common.builder;

import org.junit.Test;

import static org.junit.Assert.*;

public class AbstractBuilderTest {
	public static final class Endpoint {
		private String host = "localhost";
		private int port = 80;

		public static Builder builder() {
			return new Endpoint().new Builder();
		}

		public final class Builder extends AbstractBuilder<Builder, Endpoint> {
			public Builder withHost(String host) {
				checkNotBuilt(this);
				Endpoint.this.host = host;
				return this;
			}

			public Builder withPort(int port) {
				checkNotBuilt(this);
				Endpoint.this.port = port;
				return this;
			}

			@Override
			protected Endpoint doBuild() {
				return Endpoint.this;
			}
		}
	}

	@Test
	public void buildsConfiguredInstance() {
		Endpoint endpoint = Endpoint.builder()
				.withHost("example.com")
				.withPort(8080)
				.build();

		assertEquals("example.com", endpoint.host);
		assertEquals(8080, endpoint.port);
	}

	@Test
	public void builderIsSingleUse() {
		Endpoint.Builder builder = Endpoint.builder();
		assertFalse(builder.isBuilt());
		builder.build();
		assertTrue(builder.isBuilt());

		assertThrows(IllegalStateException.class, () -> builder.withPort(1));
		assertThrows(IllegalStateException.class, builder::build);
	}
}
