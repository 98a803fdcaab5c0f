package github.sarthakdev143.render_kit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RenderKitApplication {

	public static void main(String[] args) {
		SpringApplication.run(RenderKitApplication.class, args);
	}

}
