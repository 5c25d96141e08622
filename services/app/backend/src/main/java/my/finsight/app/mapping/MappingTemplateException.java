package my.finsight.app.mapping;

public class MappingTemplateException extends RuntimeException {
	public MappingTemplateException(String message) {
		super(message);
	}

	public MappingTemplateException(String message, Throwable cause) {
		super(message, cause);
	}
}
