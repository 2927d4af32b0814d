package com.vidnyan.astdump;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ast-dump - prints the syntax tree of a Java source file.
 *
 * Uses JavaParser as the parsing front end.
 */
@SpringBootApplication
public class AstDumpApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(AstDumpApplication.class, args)));
    }
}
