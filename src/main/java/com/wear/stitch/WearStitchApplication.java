package com.wear.stitch;

import com.wear.stitch.config.NativeLibraryLoader;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WearStitchApplication {

    public static void main(String[] args) {
        // 必须在 Spring 上下文创建之前加载 OpenCV
        NativeLibraryLoader.loadNativeLibraries();
        SpringApplication.run(WearStitchApplication.class, args);
    }
}
