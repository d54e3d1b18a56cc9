package ai.repodagger;

/**
 * Base of every failure that stops a run. Inner components throw these instead of exiting; the CLI decides how the
 * process ends.
 */
public abstract sealed class DaggerException extends Exception
        permits DaggerException.ConfigException,
                DaggerException.PatternException,
                DaggerException.FileAccessException,
                DaggerException.UnsupportedImportException,
                DaggerException.UnresolvedModuleException {

    protected DaggerException(String message) {
        super(message);
    }

    protected DaggerException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Malformed, unreadable or semantically invalid configuration. */
    public static final class ConfigException extends DaggerException {
        public ConfigException(String message) {
            super(message);
        }

        public ConfigException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /** A glob or regular expression in the configuration cannot be compiled. */
    public static final class PatternException extends DaggerException {
        public PatternException(String message) {
            super(message);
        }

        public PatternException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /** Filesystem error while scanning a directory or reading a file. Never treated as "no matches". */
    public static final class FileAccessException extends DaggerException {
        public FileAccessException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /** Relative imports (`from . import x`) are not supported. */
    public static final class UnsupportedImportException extends DaggerException {
        public UnsupportedImportException(String message) {
            super(message);
        }
    }

    /** A module identifier handed to an import-all action is neither fully qualified nor imported by the file. */
    public static final class UnresolvedModuleException extends DaggerException {
        public UnresolvedModuleException(String message) {
            super(message);
        }
    }

    /**
     * Re-wraps {@code cause} with a prefix describing where it happened, keeping the concrete type so callers can still
     * tell a pattern error from an I/O error.
     */
    public static DaggerException withContext(String context, DaggerException cause) {
        var message = context + ": " + cause.getMessage();
        if (cause instanceof ConfigException) {
            return new ConfigException(message, cause);
        } else if (cause instanceof PatternException) {
            return new PatternException(message, cause);
        } else if (cause instanceof FileAccessException) {
            return new FileAccessException(message, cause);
        } else if (cause instanceof UnsupportedImportException) {
            var wrapped = new UnsupportedImportException(message);
            wrapped.initCause(cause);
            return wrapped;
        } else {
            var wrapped = new UnresolvedModuleException(message);
            wrapped.initCause(cause);
            return wrapped;
        }
    }
}
