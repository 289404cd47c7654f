package me.go_gradually.soundrelay.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "me.go_gradually.soundrelay")
public class SoundRelayApplication {
    public static void main(String[] args) {
        SpringApplication.run(SoundRelayApplication.class, args);
    }
}
