package quest.gekko.salesboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SalesboardApplication {

    public static void main(String[] args) {
        SpringApplication.run(SalesboardApplication.class, args);
    }

}
