package com.vidnyan.sixer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * sixer - rewrites Python 2 code into Python 2/3 compatible code using six.
 *
 * <p>The process exit status is the one computed by the command-line runner.
 */
@SpringBootApplication
public class SixerApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(SixerApplication.class, args)));
    }
}
