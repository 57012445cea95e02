package github.sarthakdev143.reel_forge.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client used for generation provider calls. Timeouts come from {@code reel-forge.providers.*}.
 */
@Configuration
public class RestTemplateConfig {

    @Bean(name = "providerRestTemplate")
    public RestTemplate providerRestTemplate(ReelForgeProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) properties.providers().connectTimeout().toMillis());
        factory.setReadTimeout((int) properties.providers().readTimeout().toMillis());
        return new RestTemplate(factory);
    }
}
