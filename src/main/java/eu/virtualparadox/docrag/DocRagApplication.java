package eu.virtualparadox.docrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocRagApplication {

    public static void main(final String[] args) {
        SpringApplication.run(DocRagApplication.class, args);
    }
}
