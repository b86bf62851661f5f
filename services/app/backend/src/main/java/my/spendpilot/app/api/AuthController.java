package my.spendpilot.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.spendpilot.app.config.AppProperties;
import my.spendpilot.app.dto.AuthRequest;
import my.spendpilot.app.dto.AuthResponse;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

@RestController
@RequestMapping("/api/auth")
@Tag(name = "auth")
public class AuthController {
	private static final long TOKEN_TTL_SECONDS = 3600;
	private final AuthenticationManager authenticationManager;
	private final JwtEncoder jwtEncoder;
	private final AppProperties properties;
	private final Clock clock;

	public AuthController(AuthenticationManager authenticationManager,
						  JwtEncoder jwtEncoder,
						  AppProperties properties,
						  Clock clock) {
		this.authenticationManager = authenticationManager;
		this.jwtEncoder = jwtEncoder;
		this.properties = properties;
		this.clock = clock;
	}

	@PostMapping("/token")
	@Operation(summary = "Exchange operator credentials for a bearer token")
	public AuthResponse token(@Valid @RequestBody AuthRequest request) {
		try {
			authenticationManager.authenticate(
					new UsernamePasswordAuthenticationToken(request.username(), request.password())
			);
		} catch (AuthenticationException ex) {
			throw new IllegalArgumentException("Invalid credentials", ex);
		}
		Instant now = clock.instant();
		JwtClaimsSet claims = JwtClaimsSet.builder()
				.issuer(properties.jwt().issuer())
				.subject(request.username())
				.issuedAt(now)
				.expiresAt(now.plusSeconds(TOKEN_TTL_SECONDS))
				.claim("roles", "ADMIN")
				.build();
		JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
		String token = jwtEncoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();
		return new AuthResponse(token, "Bearer", TOKEN_TTL_SECONDS);
	}
}
