package com.sparrowwallet.ballast.io;

import com.sparrowwallet.ballast.Ballast;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public class Storage {
    private static final Logger log = LoggerFactory.getLogger(Storage.class);

    public static final String BALLAST_DIR = ".ballast";
    public static final String WINDOWS_BALLAST_DIR = "Ballast";

    public static File getBallastDir() {
        File ballastDir = getBallastHome();
        if(!ballastDir.exists()) {
            createOwnerOnlyDirectory(ballastDir);
        }

        return ballastDir;
    }

    public static File getBallastHome() {
        return getBallastHome(false);
    }

    public static File getBallastHome(boolean useDefault) {
        if(!useDefault && System.getProperty(Ballast.APP_HOME_PROPERTY) != null) {
            return new File(System.getProperty(Ballast.APP_HOME_PROPERTY));
        }

        if(isWindows()) {
            return new File(getHomeDir(), WINDOWS_BALLAST_DIR);
        }

        return new File(getHomeDir(), BALLAST_DIR);
    }

    static File getHomeDir() {
        if(isWindows()) {
            return new File(System.getenv("APPDATA"));
        }

        return new File(System.getProperty("user.home"));
    }

    public static boolean createOwnerOnlyDirectory(File directory) {
        try {
            if(isWindows()) {
                Files.createDirectories(directory.toPath());
                return true;
            }

            Files.createDirectories(directory.toPath(), PosixFilePermissions.asFileAttribute(getDirectoryOwnerOnlyPosixFilePermissions()));
            return true;
        } catch(UnsupportedOperationException e) {
            return directory.mkdirs();
        } catch(IOException e) {
            log.error("Could not create directory " + directory.getAbsolutePath(), e);
        }

        return false;
    }

    public static boolean createOwnerOnlyFile(File file) {
        try {
            if(isWindows()) {
                Files.createFile(file.toPath());
                return true;
            }

            Files.createFile(file.toPath(), PosixFilePermissions.asFileAttribute(getFileOwnerOnlyPosixFilePermissions()));
            return true;
        } catch(UnsupportedOperationException e) {
            log.debug("Owner only permissions are not supported for " + file.getAbsolutePath());
            return false;
        } catch(IOException e) {
            log.error("Could not create file " + file.getAbsolutePath(), e);
        }

        return false;
    }

    private static Set<PosixFilePermission> getDirectoryOwnerOnlyPosixFilePermissions() {
        Set<PosixFilePermission> ownerOnly = getFileOwnerOnlyPosixFilePermissions();
        ownerOnly.add(PosixFilePermission.OWNER_EXECUTE);

        return ownerOnly;
    }

    private static Set<PosixFilePermission> getFileOwnerOnlyPosixFilePermissions() {
        Set<PosixFilePermission> ownerOnly = EnumSet.noneOf(PosixFilePermission.class);
        ownerOnly.add(PosixFilePermission.OWNER_READ);
        ownerOnly.add(PosixFilePermission.OWNER_WRITE);

        return ownerOnly;
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
    }
}
